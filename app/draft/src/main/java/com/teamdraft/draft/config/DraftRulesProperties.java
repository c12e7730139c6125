/*
 * どこで: Draft アプリの設定バインド
 * 何を: conference 定員、pick 上限、手番方式、取消時のチーム解放を保持する
 * なぜ: ギルドごとの運用ルール差分をコード外で調整できるようにするため
 */
package com.teamdraft.draft.config;

import com.teamdraft.draft.model.TurnOrderPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "draft.rules")
public record DraftRulesProperties(
    @Min(1) int maxConferenceParticipants,
    @PositiveOrZero Integer defaultPicksAllowed,
    boolean restrictPicksToConference,
    TurnOrderPolicy turnOrderPolicy,
    boolean releaseTeamsOnCancel) {

  public DraftRulesProperties {
    // defaultPicksAllowed の null は「上限なし」として扱う
    turnOrderPolicy = turnOrderPolicy == null ? TurnOrderPolicy.ROUND_ROBIN : turnOrderPolicy;
  }
}
