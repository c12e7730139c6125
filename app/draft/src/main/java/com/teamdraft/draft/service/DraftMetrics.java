/*
 * どこで: Draft サービス層
 * 何を: アクション結果と outbox 配信のメトリクス記録を集約する
 * なぜ: 競合やエラー種別の発生率と配信遅延を運用で監視できるようにするため
 */
package com.teamdraft.draft.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DraftMetrics {

  static final String METRIC_ACTION_TOTAL = "draft.action.total";
  static final String METRIC_STAGE_TRANSITION_TOTAL = "draft.stage.transition.total";
  static final String METRIC_OUTBOX_PUBLISH_DELAY = "draft.outbox.publish.delay";
  static final String METRIC_OUTBOX_BACKLOG_AGE = "draft.outbox.backlog.age";
  static final String METRIC_OUTBOX_FAILED_CURRENT = "draft.outbox.failed.current";
  static final String RESULT_SUCCESS = "success";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger outboxFailedCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer outboxPublishDelayTimer;
  private final Timer outboxBacklogAgeTimer;

  public DraftMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_OUTBOX_FAILED_CURRENT, outboxFailedCurrent, AtomicInteger::get)
        .description("Current number of FAILED draft outbox events")
        .register(meterRegistry);
    this.outboxPublishDelayTimer =
        Timer.builder(METRIC_OUTBOX_PUBLISH_DELAY)
            .description("Delay from draft event creation to JetStream ack")
            .register(meterRegistry);
    this.outboxBacklogAgeTimer =
        Timer.builder(METRIC_OUTBOX_BACKLOG_AGE)
            .description("Age of a draft event when the publisher claims it")
            .register(meterRegistry);
  }

  /** result は success かエラーコード名(小文字)。 */
  public void recordAction(String action, String result) {
    counter(
            METRIC_ACTION_TOTAL,
            "Draft actions by kind and result",
            Tags.of("action", action.toLowerCase(Locale.ROOT), "result", result))
        .increment();
  }

  public void recordStageTransition(String from, String to) {
    counter(
            METRIC_STAGE_TRANSITION_TOTAL,
            "Draft stage transitions",
            Tags.of("from", from, "to", to))
        .increment();
  }

  public void recordOutboxPublishDelay(Instant createdAt, Instant publishedAt) {
    if (createdAt == null || publishedAt == null || publishedAt.isBefore(createdAt)) {
      return;
    }
    outboxPublishDelayTimer.record(Duration.between(createdAt, publishedAt));
  }

  public void recordOutboxBacklogAge(Instant createdAt, Instant observedAt) {
    if (createdAt == null || observedAt == null || observedAt.isBefore(createdAt)) {
      return;
    }
    outboxBacklogAgeTimer.record(Duration.between(createdAt, observedAt));
  }

  public void updateOutboxFailedCurrent(int failedCount) {
    outboxFailedCurrent.set(Math.max(failedCount, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
