/*
 * どこで: Draft ドメインモデル
 * 何を: claim 済み outbox イベントを表す
 * なぜ: Publisher が DB 行から送信に必要な情報だけを扱えるようにするため
 */
package com.teamdraft.draft.model;

import java.util.UUID;

public record OutboxEventRecord(
    UUID eventId,
    long sequenceNo,
    String eventType,
    String aggregateKey,
    String payloadJson,
    int attemptCount) {}
