/*
 * どこで: Draft NATS 初期化
 * 何を: 起動時に draft イベント用の JetStream stream を作成/更新する
 * なぜ: publish 前に stream を確保し、Nats-Msg-Id による重複排除を効かせるため
 */
package com.teamdraft.draft.nats;

import com.teamdraft.draft.config.DraftNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "draft.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class DraftJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(DraftJetStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final DraftNatsProperties properties;

  @PostConstruct
  public void ensureStream() {
    if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("draft.nats.duplicate-window must be positive");
    }
    final StreamConfiguration configuration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    try {
      final JetStreamManagement management = connection.jetStreamManagement();
      if (streamExists(management)) {
        management.updateStream(configuration);
      } else {
        management.addStream(configuration);
      }
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream stream " + properties.stream(), ex);
    }
    logger.info(
        "draft stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private boolean streamExists(JetStreamManagement management)
      throws IOException, JetStreamApiException {
    try {
      management.getStreamInfo(properties.stream());
      return true;
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR) {
        return false;
      }
      throw ex;
    }
  }
}
