/*
 * どこで: Status Aggregator 設定
 * 何を: プロバイダ呼び出し専用の RestClient を提供する
 * なぜ: 全アダプタで同じタイムアウト設定の通信層を共有するため
 */
package com.statusio.aggregator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({ProviderClientProperties.class, ProviderHttpProperties.class})
public class ProviderClientConfig {

  @Bean
  RestClient providerRestClient(RestClient.Builder builder, ProviderHttpProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
