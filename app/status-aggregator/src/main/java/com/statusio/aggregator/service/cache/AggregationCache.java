package com.statusio.aggregator.service.cache;

import com.statusio.aggregator.model.ProviderStatus;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** 資格情報フィンガープリント単位で集約結果を TTL 付きで保持する。 */
public interface AggregationCache {

  /** 未登録または期限切れなら empty。期限切れのエントリは読み出し時に取り除かれる。 */
  Optional<List<ProviderStatus>> get(String fingerprint);

  /** 無条件に上書きし、期限は現在時刻 + ttl とする。 */
  void put(String fingerprint, List<ProviderStatus> value, Duration ttl);
}
