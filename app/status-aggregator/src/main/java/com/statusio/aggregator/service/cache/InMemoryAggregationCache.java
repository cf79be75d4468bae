/*
 * どこで: Status Aggregator キャッシュ層
 * 何を: 集約結果をプロセス内メモリに期限付きで保持する
 * なぜ: 同一資格情報での連続リクエストがプロバイダのレート制限に当たらないようにするため
 */
package com.statusio.aggregator.service.cache;

import com.statusio.aggregator.model.ProviderStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Clock は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class InMemoryAggregationCache implements AggregationCache {

  private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryAggregationCache(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<List<ProviderStatus>> get(String fingerprint) {
    final CacheEntry entry = entries.get(fingerprint);
    if (entry == null) {
      return Optional.empty();
    }
    if (!clock.instant().isBefore(entry.expiresAt())) {
      // 同じキーへ並行して書き込まれた新しいエントリは消さない
      entries.remove(fingerprint, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public void put(String fingerprint, List<ProviderStatus> value, Duration ttl) {
    entries.put(fingerprint, new CacheEntry(List.copyOf(value), clock.instant().plus(ttl)));
  }

  public int size() {
    return entries.size();
  }

  private record CacheEntry(List<ProviderStatus> value, Instant expiresAt) {}
}
