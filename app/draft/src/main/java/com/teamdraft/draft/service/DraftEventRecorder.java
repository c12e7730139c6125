/*
 * どこで: Draft サービス層
 * 何を: draft の状態変化を outbox_events へ追記する
 * なぜ: 状態更新と同じトランザクションでイベントを残し、配信漏れを防ぐため
 */
package com.teamdraft.draft.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamdraft.common.event.DraftEventPayload;
import com.teamdraft.draft.model.DraftEventType;
import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.repository.OutboxEventRepository;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DraftEventRecorder {

  private final OutboxEventRepository outboxEventRepository;
  private final ObjectMapper objectMapper;

  public void draftCreated(DraftRecord draft, long actorUserId, String traceId) {
    append(DraftEventType.DRAFT_CREATED, draft, actorUserId, null, null, null, null, traceId,
        draft.createdAt());
  }

  public void conferenceChosen(
      DraftRecord draft, long userId, String conference, String traceId, Instant occurredAt) {
    append(DraftEventType.CONFERENCE_CHOSEN, draft, userId, conference, null, null, null, traceId,
        occurredAt);
  }

  public void teamClaimed(
      DraftRecord draft,
      long userId,
      String conference,
      String teamName,
      String traceId,
      Instant occurredAt) {
    append(DraftEventType.TEAM_CLAIMED, draft, userId, conference, teamName, null, null, traceId,
        occurredAt);
  }

  public void pickMade(
      DraftRecord draft,
      long userId,
      String teamName,
      int pickNumber,
      Long nextUserId,
      String traceId,
      Instant occurredAt) {
    append(DraftEventType.PICK_MADE, draft, userId, null, teamName, pickNumber, nextUserId, traceId,
        occurredAt);
  }

  public void stageChanged(DraftRecord draft, Long nextUserId, String traceId, Instant occurredAt) {
    append(DraftEventType.DRAFT_STAGE_CHANGED, draft, null, null, null, null, nextUserId, traceId,
        occurredAt);
  }

  public void completed(DraftRecord draft, String traceId, Instant occurredAt) {
    append(DraftEventType.DRAFT_COMPLETED, draft, null, null, null, null, null, traceId,
        occurredAt);
  }

  public void cancelled(DraftRecord draft, long actorUserId, String traceId, Instant occurredAt) {
    append(DraftEventType.DRAFT_CANCELLED, draft, actorUserId, null, null, null, null, traceId,
        occurredAt);
  }

  private void append(
      DraftEventType type,
      DraftRecord draft,
      Long userId,
      String conference,
      String teamName,
      Integer pickNumber,
      Long nextUserId,
      String traceId,
      Instant occurredAt) {
    final UUID eventId = UUID.randomUUID();
    final DraftEventPayload payload =
        new DraftEventPayload(
            eventId.toString(),
            type.eventName(),
            occurredAt.toString(),
            draft.id(),
            draft.guildId(),
            draft.channelId(),
            userId,
            draft.stage().name(),
            draft.status().name(),
            conference,
            teamName,
            pickNumber,
            nextUserId,
            traceId);
    outboxEventRepository.append(
        eventId, type.eventName(), "draft:" + draft.id(), toJson(payload), occurredAt);
  }

  private String toJson(DraftEventPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize outbox payload", ex);
    }
  }
}
