/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 残日数計算とキャッシュ失効を同一の時刻源で判定し、テストで固定できるようにするため
 */
package com.statusio.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
