/*
 * どこで: DraftOutboxPublisher のユニットテスト
 * 何を: publish 成功・一時失敗・payload 破損時の outbox 状態遷移とヘッダを検証する
 * なぜ: ack を受けたイベントだけを PUBLISHED にし、失敗はバックオフ付きで再送させるため
 */
package com.teamdraft.draft.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamdraft.common.event.DraftEventPayload;
import com.teamdraft.draft.config.DraftNatsProperties;
import com.teamdraft.draft.config.DraftOutboxProperties;
import com.teamdraft.draft.model.OutboxEventRecord;
import com.teamdraft.draft.model.OutboxStatus;
import com.teamdraft.draft.repository.OutboxEventRepository;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DraftOutboxPublisherTest {

  private static final Instant NOW = Instant.parse("2026-04-02T09:00:00Z");
  private static final String SUBJECT = "draft.events";
  private static final DraftOutboxProperties PROPERTIES =
      new DraftOutboxProperties(
          true,
          Duration.ofSeconds(1),
          50,
          3,
          Duration.ofSeconds(1),
          Duration.ofSeconds(60),
          2.0d,
          0.5d,
          1.5d,
          Duration.ofSeconds(1),
          200,
          Duration.ofSeconds(30),
          Duration.ofHours(24));

  @Mock private JetStream jetStream;
  @Mock private OutboxEventRepository outboxEventRepository;
  @Mock private DraftMetrics metrics;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private DraftOutboxPublisher publisher;

  @BeforeEach
  void setUp() {
    publisher =
        new DraftOutboxPublisher(
            jetStream,
            outboxEventRepository,
            PROPERTIES,
            new DraftNatsProperties(SUBJECT, "DRAFT_EVENTS", Duration.ofMinutes(2)),
            objectMapper,
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void publishesClaimedEventsWithDedupHeaders() throws Exception {
    final OutboxEventRecord first = record(1L, 0, "trace-1");
    final OutboxEventRecord second = record(2L, 0, null);
    when(outboxEventRepository.claimBatch(eq(50), eq(NOW), eq(NOW.plusSeconds(30)), anyString()))
        .thenReturn(List.of(first, second));
    when(jetStream.publish(eq(SUBJECT), any(Headers.class), any(byte[].class)))
        .thenReturn(mock(PublishAck.class));
    when(outboxEventRepository.markPublished(any(UUID.class), anyString(), eq(NOW)))
        .thenReturn(1);

    assertThat(publisher.publishPendingBatch()).isEqualTo(2);

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> bodies = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream, times(2))
        .publish(eq(SUBJECT), headers.capture(), bodies.capture());
    final Headers firstHeaders = headers.getAllValues().get(0);
    assertThat(firstHeaders.getFirst("Nats-Msg-Id")).isEqualTo(first.eventId().toString());
    assertThat(firstHeaders.getFirst("event_type")).isEqualTo("PickMade");
    assertThat(firstHeaders.getFirst("aggregate_key")).isEqualTo("draft:5");
    assertThat(firstHeaders.getFirst("draft_id")).isEqualTo("5");
    assertThat(firstHeaders.getFirst("trace_id")).isEqualTo("trace-1");
    assertThat(headers.getAllValues().get(1).containsKey("trace_id")).isFalse();
    // payload は DB に保存した JSON をそのまま送る
    assertThat(new String(bodies.getAllValues().get(0), StandardCharsets.UTF_8))
        .isEqualTo(first.payloadJson());
    verify(metrics).updateOutboxFailedCurrent(0);
  }

  @Test
  void unreadablePayloadIsFailedWithoutPublishing() {
    final OutboxEventRecord broken =
        new OutboxEventRecord(UUID.randomUUID(), 3L, "PickMade", "draft:5", "{not json", 0);
    when(outboxEventRepository.claimBatch(
            anyInt(), any(Instant.class), any(Instant.class), anyString()))
        .thenReturn(List.of(broken));
    when(outboxEventRepository.countByStatus(OutboxStatus.FAILED)).thenReturn(1);

    assertThat(publisher.publishPendingBatch()).isZero();

    verifyNoInteractions(jetStream);
    verify(outboxEventRepository)
        .markRetryOrFailed(
            eq(broken.eventId()),
            anyString(),
            eq(PROPERTIES.maxAttempts()),
            eq(OutboxStatus.FAILED),
            isNull(),
            anyString());
    verify(metrics).updateOutboxFailedCurrent(1);
  }

  @Test
  void transientPublishFailureSchedulesRetry() throws Exception {
    final OutboxEventRecord event = record(4L, 0, null);
    when(outboxEventRepository.claimBatch(
            anyInt(), any(Instant.class), any(Instant.class), anyString()))
        .thenReturn(List.of(event));
    when(jetStream.publish(eq(SUBJECT), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("connection reset"));

    assertThat(publisher.publishPendingBatch()).isZero();

    final ArgumentCaptor<Instant> nextRetryAt = ArgumentCaptor.forClass(Instant.class);
    verify(outboxEventRepository)
        .markRetryOrFailed(
            eq(event.eventId()),
            anyString(),
            eq(1),
            eq(OutboxStatus.PENDING),
            nextRetryAt.capture(),
            eq("connection reset"));
    assertThat(nextRetryAt.getValue()).isAfter(NOW);
    verify(outboxEventRepository, never())
        .markPublished(any(UUID.class), anyString(), any(Instant.class));
  }

  @Test
  void lastAttemptFailureGivesUp() throws Exception {
    final OutboxEventRecord event = record(5L, PROPERTIES.maxAttempts() - 1, null);
    when(outboxEventRepository.claimBatch(
            anyInt(), any(Instant.class), any(Instant.class), anyString()))
        .thenReturn(List.of(event));
    when(jetStream.publish(eq(SUBJECT), any(Headers.class), any(byte[].class)))
        .thenThrow(new IllegalStateException("stream not found"));

    publisher.publishPendingBatch();

    verify(outboxEventRepository)
        .markRetryOrFailed(
            eq(event.eventId()),
            anyString(),
            eq(PROPERTIES.maxAttempts()),
            eq(OutboxStatus.FAILED),
            isNull(),
            eq("stream not found"));
  }

  @Test
  void backoffGrowsAndStaysWithinCap() {
    for (int i = 0; i < 20; i++) {
      assertThat(publisher.backoff(1)).isBetween(Duration.ofSeconds(1), Duration.ofMillis(1500));
      assertThat(publisher.backoff(3)).isBetween(Duration.ofSeconds(2), Duration.ofSeconds(6));
      assertThat(publisher.backoff(20)).isBetween(Duration.ofSeconds(30), Duration.ofSeconds(90));
    }
  }

  private OutboxEventRecord record(long sequenceNo, int attemptCount, String traceId)
      throws Exception {
    final UUID eventId = UUID.randomUUID();
    final DraftEventPayload payload =
        new DraftEventPayload(
            eventId.toString(),
            "PickMade",
            NOW.minusSeconds(2).toString(),
            5L,
            77L,
            null,
            11L,
            "DRAFTING",
            "ACTIVE",
            null,
            "Georgia",
            (int) sequenceNo,
            12L,
            traceId);
    return new OutboxEventRecord(
        eventId,
        sequenceNo,
        "PickMade",
        "draft:5",
        objectMapper.writeValueAsString(payload),
        attemptCount);
  }
}
