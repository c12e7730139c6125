/*
 * どこで: Draft ドメインモデル
 * 何を: drafts テーブルのスナップショットを表す
 * なぜ: オーケストレータと参照 API で共通化するため
 */
package com.teamdraft.draft.model;

import java.time.Instant;

public record DraftRecord(
    long id,
    long guildId,
    Long channelId,
    DraftStatus status,
    DraftStage stage,
    int currentPickIndex,
    Instant createdAt,
    Instant updatedAt) {

  public DraftRecord withProgress(
      DraftStatus newStatus, DraftStage newStage, int newPickIndex, Instant now) {
    return new DraftRecord(
        id, guildId, channelId, newStatus, newStage, newPickIndex, createdAt, now);
  }
}
