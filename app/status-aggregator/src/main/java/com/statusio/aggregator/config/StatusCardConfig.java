/*
 * どこで: Status Aggregator 設定
 * 何を: ステータスカードの一言選択に使う乱数源を提供する
 * なぜ: テストで乱数源を差し替えて選択結果を再現できるようにするため
 */
package com.statusio.aggregator.config;

import java.util.random.RandomGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatusCardConfig {

  @Bean
  RandomGenerator quoteRandom() {
    return RandomGenerator.getDefault();
  }
}
