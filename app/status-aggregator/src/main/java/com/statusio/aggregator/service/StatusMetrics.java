/*
 * どこで: Status Aggregator サービス層
 * 何を: 集約結果とプロバイダ呼び出しの件数・所要時間を記録する
 * なぜ: プロバイダごとの UNKNOWN 増加や遅延、キャッシュヒット率を Prometheus から観測できるようにするため
 */
package com.statusio.aggregator.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class StatusMetrics {

  static final String METRIC_AGGREGATE_TOTAL = "statusio.aggregate.total";
  static final String METRIC_PROVIDER_CALL_TOTAL = "statusio.provider.call.total";
  static final String METRIC_PROVIDER_CALL_DURATION = "statusio.provider.call.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> aggregateCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> providerCallCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> providerCallTimers = new ConcurrentHashMap<>();

  public StatusMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /** result は cache_hit / fetched / empty / error のいずれか。 */
  public void recordAggregateResult(String result) {
    aggregateCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_AGGREGATE_TOTAL)
                    .description("Status aggregation outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordProviderCall(String provider, String state, Duration duration) {
    final String key = provider + "|" + state;
    providerCallCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_PROVIDER_CALL_TOTAL)
                    .description("Provider account info calls by resulting state")
                    .tags(Tags.of("provider", provider, "state", state))
                    .register(meterRegistry))
        .increment();
    providerCallTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_PROVIDER_CALL_DURATION)
                    .description("Provider account info call duration")
                    .tags(Tags.of("provider", provider, "state", state))
                    .register(meterRegistry))
        .record(duration);
  }
}
