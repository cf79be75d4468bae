/*
 * どこで: Status Aggregator 設定
 * 何を: プロバイダ呼び出しの接続/読み取りタイムアウトを保持する
 * なぜ: 集約側ではタイムアウトを持たず、通信層の設定だけで 1 呼び出しの上限を決めるため
 */
package com.statusio.aggregator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "statusio.http")
public record ProviderHttpProperties(Duration connectTimeout, Duration readTimeout) {

  public ProviderHttpProperties {
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }
}
