/*
 * どこで: Status Aggregator 設定
 * 何を: 集約処理の設定バインドとプロバイダ呼び出し用スレッドプールを提供する
 * なぜ: fan-out の並列度とキャッシュ TTL を集約サービスから切り離して管理するため
 */
package com.statusio.aggregator.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  StatusCacheProperties.class,
  StatusExecutorProperties.class,
  DefaultCredentialsProperties.class
})
public class AggregationConfig {

  @Bean(destroyMethod = "shutdown")
  ExecutorService providerExecutor(StatusExecutorProperties properties) {
    return Executors.newFixedThreadPool(
        properties.poolSize(),
        new ThreadFactoryBuilder().setNameFormat("provider-call-%d").setDaemon(true).build());
  }
}
