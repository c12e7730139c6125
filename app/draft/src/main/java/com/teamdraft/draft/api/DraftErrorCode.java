/*
 * どこで: Draft API
 * 何を: draft 操作の失敗種別を定義する
 * なぜ: チャット連携側が原因ごとに利用者向け文言を出し分けられるようにするため
 */
package com.teamdraft.draft.api;

public enum DraftErrorCode {
  BAD_REQUEST,
  DRAFT_NOT_FOUND,
  DRAFT_ALREADY_OPEN,
  NOT_A_PARTICIPANT,
  INVALID_STAGE,
  ALREADY_CHOSEN,
  UNKNOWN_CONFERENCE,
  CONFERENCE_FULL,
  TEAM_ALREADY_CLAIMED,
  TEAM_UNAVAILABLE,
  NOT_YOUR_TURN,
  LIMIT_REACHED,
  DRAFT_CANCELLED,
  DRAFT_COMPLETED,
  INTERNAL_ERROR;

  // 呼び出し側が最新の空きチームを読み直して再送してよい競合のみ true
  public boolean retryable() {
    return this == TEAM_ALREADY_CLAIMED;
  }
}
