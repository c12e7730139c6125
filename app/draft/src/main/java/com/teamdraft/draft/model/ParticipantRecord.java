/*
 * どこで: Draft ドメインモデル
 * 何を: participants テーブルの1行を表す
 * なぜ: claim/conference の状態と手番順を一緒に扱うため
 */
package com.teamdraft.draft.model;

public record ParticipantRecord(
    long draftId,
    long userId,
    int pickOrder,
    String conference,
    boolean conferenceChosen,
    String claimedTeam,
    boolean claimed) {}
