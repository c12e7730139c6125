/*
 * どこで: Draft ドメインモデル
 * 何を: teams.json のルート構造を表す
 * なぜ: Jackson で conference ごとのチーム一覧をそのまま読み込むため
 */
package com.teamdraft.draft.model;

import java.util.List;

public record TeamCatalogDocument(List<ConferenceDefinition> conferences) {

  public TeamCatalogDocument {
    conferences = conferences == null ? List.of() : List.copyOf(conferences);
  }
}
