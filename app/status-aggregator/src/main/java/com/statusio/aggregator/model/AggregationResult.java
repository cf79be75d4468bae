/*
 * どこで: Status Aggregator ドメインモデル
 * 何を: 1 回の集約結果(プロバイダ別状態と有効プロバイダ一覧)を表現する
 * なぜ: 表示層がデータ有無を判定するための hasData を結果と一緒に渡すため
 */
package com.statusio.aggregator.model;

import java.util.List;

public record AggregationResult(List<ProviderStatus> results, List<ProviderId> enabledProviders) {

  public AggregationResult {
    results = results == null ? List.of() : List.copyOf(results);
    enabledProviders = enabledProviders == null ? List.of() : List.copyOf(enabledProviders);
  }

  public static AggregationResult empty() {
    return new AggregationResult(List.of(), List.of());
  }

  /** 状態が判明した結果、またはアカウント ID を持つ結果が 1 つでもあれば true。 */
  public boolean hasData() {
    return results.stream().anyMatch(StatusBucket::isDisplayable);
  }
}
