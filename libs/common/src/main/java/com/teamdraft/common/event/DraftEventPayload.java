/*
 * どこで: common のイベント payload 定義
 * 何を: Draft の outbox payload を共通レコードとして提供する
 * なぜ: draft サービスとチャット連携側で同一のペイロード形状を共有するため
 */
package com.teamdraft.common.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DraftEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    long draftId,
    long guildId,
    Long channelId,
    Long userId,
    String stage,
    String status,
    String conference,
    String teamName,
    Integer pickNumber,
    Long nextUserId,
    String traceId) {}
