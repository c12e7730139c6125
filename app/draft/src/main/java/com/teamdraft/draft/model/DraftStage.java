/*
 * どこで: Draft ドメインモデル
 * 何を: draft の進行フェーズを定義する
 * なぜ: アクションの受付可否をフェーズで判定するため
 */
package com.teamdraft.draft.model;

public enum DraftStage {
  CONFERENCE,
  CLAIM,
  DRAFTING,
  DONE
}
