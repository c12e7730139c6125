/*
 * どこで: Draft retention サービス
 * 何を: publish 済みで保持期間を過ぎた outbox イベントを削除する
 * なぜ: outbox_events の肥大化を防ぐため
 */
package com.teamdraft.draft.service;

import com.teamdraft.draft.config.DraftOutboxProperties;
import com.teamdraft.draft.repository.OutboxEventRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DraftRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(DraftRetentionService.class);

  private final OutboxEventRepository outboxEventRepository;
  private final DraftOutboxProperties outboxProperties;
  private final Clock clock;

  public int cleanup() {
    // 未送信/FAILED は調査のため残す
    final Instant threshold = Instant.now(clock).minus(outboxProperties.publishedTtl());
    final int deleted = outboxEventRepository.deletePublishedBefore(threshold);
    logger.info("draft retention cleanup deleted outboxEvents={} threshold={}", deleted, threshold);
    return deleted;
  }
}
