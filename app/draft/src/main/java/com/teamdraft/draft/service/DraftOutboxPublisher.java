/*
 * どこで: Draft outbox publish サービス
 * 何を: claim した outbox_events を JetStream へ JSON のまま publish する
 * なぜ: DB コミット済みのイベントだけを、ack 確認付きで少なくとも1回配信するため
 */
package com.teamdraft.draft.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamdraft.common.event.DraftEventPayload;
import com.teamdraft.draft.config.DraftNatsProperties;
import com.teamdraft.draft.config.DraftOutboxProperties;
import com.teamdraft.draft.model.OutboxEventRecord;
import com.teamdraft.draft.model.OutboxStatus;
import com.teamdraft.draft.repository.OutboxEventRepository;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "draft.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class DraftOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(DraftOutboxPublisher.class);
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_AGGREGATE_KEY = "aggregate_key";
  private static final String HEADER_DRAFT_ID = "draft_id";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final OutboxEventRepository outboxEventRepository;
  private final DraftOutboxProperties properties;
  private final DraftNatsProperties natsProperties;
  private final ObjectMapper objectMapper;
  private final DraftMetrics metrics;
  private final Clock clock;

  /** @return publish に成功した件数 */
  public int publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    final List<OutboxEventRecord> batch =
        outboxEventRepository.claimBatch(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    int published = 0;
    for (OutboxEventRecord record : batch) {
      if (publishOne(record, lockedBy, now)) {
        published++;
      }
    }
    metrics.updateOutboxFailedCurrent(outboxEventRepository.countByStatus(OutboxStatus.FAILED));
    return published;
  }

  private boolean publishOne(OutboxEventRecord record, String lockedBy, Instant now) {
    final DraftEventPayload payload;
    try {
      payload = objectMapper.readValue(record.payloadJson(), DraftEventPayload.class);
    } catch (JsonProcessingException ex) {
      // 壊れた payload は再送しても直らないので即 FAILED にする
      markFailure(record, lockedBy, now, ex, true);
      return false;
    }
    final Instant occurredAt = Instant.parse(payload.occurredAt());
    metrics.recordOutboxBacklogAge(occurredAt, now);
    try {
      final PublishAck ack =
          jetStream.publish(
              natsProperties.subject(),
              headersOf(record, payload),
              record.payloadJson().getBytes(StandardCharsets.UTF_8));
      if (ack == null) {
        throw new IllegalStateException("puback is missing");
      }
    } catch (IOException | JetStreamApiException | RuntimeException ex) {
      markFailure(record, lockedBy, now, ex, false);
      return false;
    }
    if (outboxEventRepository.markPublished(record.eventId(), lockedBy, now) == 0) {
      // リース切れで他インスタンスが再 claim した。Nats-Msg-Id で重複排除される
      logger.warn("outbox lease lost after publish eventId={}", record.eventId());
      return false;
    }
    metrics.recordOutboxPublishDelay(occurredAt, now);
    return true;
  }

  private Headers headersOf(OutboxEventRecord record, DraftEventPayload payload) {
    final Headers headers = new Headers();
    headers.add(HEADER_MESSAGE_ID, payload.eventId());
    headers.add(HEADER_EVENT_TYPE, record.eventType());
    headers.add(HEADER_AGGREGATE_KEY, record.aggregateKey());
    headers.add(HEADER_DRAFT_ID, String.valueOf(payload.draftId()));
    if (payload.traceId() != null) {
      headers.add(HEADER_TRACE_ID, payload.traceId());
    }
    return headers;
  }

  private void markFailure(
      OutboxEventRecord record, String lockedBy, Instant now, Exception ex, boolean permanent) {
    final int attempt = permanent ? properties.maxAttempts() : record.attemptCount() + 1;
    final boolean failed = attempt >= properties.maxAttempts();
    final int updated =
        outboxEventRepository.markRetryOrFailed(
            record.eventId(),
            lockedBy,
            attempt,
            failed ? OutboxStatus.FAILED : OutboxStatus.PENDING,
            failed ? null : now.plus(backoff(attempt)),
            truncate(ex.getMessage()));
    if (updated == 0) {
      logger.warn(
          "outbox failure not recorded because lease was lost eventId={} attempt={}",
          record.eventId(),
          attempt);
    }
    if (permanent) {
      logger.error("outbox payload is unreadable; marked FAILED eventId={}", record.eventId(), ex);
    } else if (failed) {
      logger.warn(
          "outbox publish gave up eventId={} attempts={}", record.eventId(), attempt, ex);
    } else {
      logger.warn(
          "outbox publish failed; retry scheduled eventId={} attempt={}",
          record.eventId(),
          attempt,
          ex);
    }
  }

  Duration backoff(int attempt) {
    final double exponential =
        properties.backoffBase().toMillis()
            * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exponential, properties.backoffMax().toMillis());
    final double jitter =
        properties.backoffJitterMin()
            + ThreadLocalRandom.current().nextDouble()
                * (properties.backoffJitterMax() - properties.backoffJitterMin());
    final long millis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(properties.backoffMin().toMillis(), millis));
  }

  private String truncate(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int max = properties.errorMessageMaxLength();
    return message.length() <= max ? message : message.substring(0, max);
  }

  private String resolveLockedBy() {
    final String hostname = System.getenv("HOSTNAME");
    if (hostname != null && !hostname.isBlank()) {
      return hostname;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
