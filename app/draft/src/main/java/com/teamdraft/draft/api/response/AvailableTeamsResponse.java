/*
 * どこで: Draft API
 * 何を: 未割当チームを conference ごとに返す
 * なぜ: 利用者が pick 前に選べる候補を確認できるようにするため
 */
package com.teamdraft.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AvailableTeamsResponse(
    long draftId, int totalAvailable, List<ConferenceTeams> conferences) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ConferenceTeams(String conference, List<String> teams) {}
}
