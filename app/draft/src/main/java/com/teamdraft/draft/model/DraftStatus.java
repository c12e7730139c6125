/*
 * どこで: Draft ドメインモデル
 * 何を: draft のライフサイクル状態を定義する
 * なぜ: drafts.status の CHECK 制約と値を一致させるため
 */
package com.teamdraft.draft.model;

public enum DraftStatus {
  PENDING,
  ACTIVE,
  COMPLETED,
  CANCELLED
}
