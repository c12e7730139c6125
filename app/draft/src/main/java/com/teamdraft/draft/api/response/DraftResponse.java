/*
 * どこで: Draft API
 * 何を: draft の状態・参加者・pick 履歴をまとめて返す
 * なぜ: /status 相当の表示を1回の参照で組み立てられるようにするため
 */
package com.teamdraft.draft.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DraftResponse(
    long draftId,
    long guildId,
    Long channelId,
    String status,
    String stage,
    int currentPickIndex,
    Long currentTurnUserId,
    Instant createdAt,
    Instant updatedAt,
    List<ParticipantResponse> participants,
    List<PickResponse> picks) {}
