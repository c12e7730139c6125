/*
 * どこで: Draft ドメインモデル
 * 何を: 取得済みチームの保持者(claim か pick か、pick 番号)を表す
 * なぜ: 競合時に誰がどの経路で確保したかを返すため
 */
package com.teamdraft.draft.model;

public record TeamHolder(
    String teamName, long draftId, long userId, TeamSource source, Integer pickNumber) {}
