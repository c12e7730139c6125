/*
 * どこで: Draft アプリの時刻設定
 * 何を: UTC の Clock を Bean として提供する
 * なぜ: ドラフトと outbox の時刻計算をテストで固定できるようにするため
 */
package com.teamdraft.draft.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DraftClockConfig {

  // テスト側で固定 Clock を定義した場合はそちらを優先する
  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock draftClock() {
    return Clock.systemUTC();
  }
}
