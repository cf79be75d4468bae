/*
 * どこで: status-aggregator のログ設定テスト
 * 何を: JSON ログ設定と trace/span・リクエスト MDC・集約 ID フィールド定義の存在を検証する
 * なぜ: 設定変更で構造化ログやトレース連携が欠落する回帰を防ぐため
 */
package com.statusio.aggregator;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonAndTraceFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"trace_id\":\"%X{trace_id:-%X{traceId:-}}\"");
    assertThat(configText).contains("\"span_id\":\"%X{span_id:-%X{spanId:-}}\"");
  }

  @Test
  void logbackConfigurationEmitsRequestAndAggregationMdcKeys() throws IOException {
    final String configText =
        new String(
            new ClassPathResource("logback-spring.xml").getInputStream().readAllBytes(),
            StandardCharsets.UTF_8);

    // RequestMdcInterceptor と StatusAggregationService が MDC へ置くキー
    for (String key :
        List.of("request_id", "http_method", "http_path", "client_ip", "aggregation_id")) {
      assertThat(configText).contains("\"" + key + "\":\"%X{" + key + ":-}\"");
    }
    assertThat(configText).contains("\"service\":\"${APP_NAME}\"");
  }
}
