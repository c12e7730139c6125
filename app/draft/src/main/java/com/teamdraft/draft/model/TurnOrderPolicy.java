/*
 * どこで: Draft ドメインモデル
 * 何を: 手番の巡回方式を定義する
 * なぜ: 単純な巡回と snake(ラウンドごとに逆順) を設定で切り替えるため
 */
package com.teamdraft.draft.model;

public enum TurnOrderPolicy {
  ROUND_ROBIN,
  SNAKE
}
