package com.teamdraft.draft.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

// outbox の定期 publish。前回のバッチが終わってから poll-interval 待つ
@Component
@ConditionalOnProperty(name = "draft.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class DraftOutboxWorker {

  private final DraftOutboxPublisher publisher;

  @Scheduled(fixedDelayString = "${draft.outbox.poll-interval}")
  public void run() {
    publisher.publishPendingBatch();
  }
}
