package com.teamdraft.draft.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "draft.retention.enabled", havingValue = "true")
public class DraftRetentionWorker {

  private final DraftRetentionService retentionService;

  @Scheduled(fixedDelayString = "${draft.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
