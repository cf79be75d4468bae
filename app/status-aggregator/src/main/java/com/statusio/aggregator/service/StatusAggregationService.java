/*
 * どこで: Status Aggregator サービス層
 * 何を: 有効なプロバイダへ並列に問い合わせ、結果を固定順で集約してキャッシュする
 * なぜ: 1 プロバイダの遅延や障害が他プロバイダの結果取得を妨げないようにしつつ、呼び出し回数を抑えるため
 */
package com.statusio.aggregator.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.statusio.aggregator.config.DefaultCredentialsProperties;
import com.statusio.aggregator.config.StatusCacheProperties;
import com.statusio.aggregator.model.AggregationResult;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.ProviderId;
import com.statusio.aggregator.model.ProviderStatus;
import com.statusio.aggregator.provider.ProviderAdapter;
import com.statusio.aggregator.service.cache.AggregationCache;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Executor とキャッシュは Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class StatusAggregationService {

  private static final Logger logger = LoggerFactory.getLogger(StatusAggregationService.class);
  static final String MDC_AGGREGATION_ID = "aggregation_id";
  /** 期限計算が Instant の範囲を超えないための上限(約 10 年)。 */
  static final long MAX_TTL_MINUTES = 10L * 365 * 24 * 60;

  private final Map<ProviderId, ProviderAdapter> adapters;
  private final AggregationCache cache;
  private final StatusFingerprint fingerprint;
  private final ExecutorService providerExecutor;
  private final StatusCacheProperties cacheProperties;
  private final CredentialSet defaultCredentials;
  private final StatusMetrics metrics;

  public StatusAggregationService(
      List<ProviderAdapter> adapters,
      AggregationCache cache,
      StatusFingerprint fingerprint,
      @Qualifier("providerExecutor") ExecutorService providerExecutor,
      StatusCacheProperties cacheProperties,
      DefaultCredentialsProperties defaultCredentials,
      StatusMetrics metrics) {
    this.adapters = new EnumMap<>(ProviderId.class);
    for (ProviderAdapter adapter : adapters) {
      if (this.adapters.put(adapter.providerId(), adapter) != null) {
        throw new IllegalStateException("duplicate adapter for " + adapter.providerId().tag());
      }
    }
    this.cache = cache;
    this.fingerprint = fingerprint;
    this.providerExecutor = providerExecutor;
    this.cacheProperties = cacheProperties;
    this.defaultCredentials = defaultCredentials.toCredentialSet();
    this.metrics = metrics;
  }

  /**
   * 役割: 資格情報に対応する全プロバイダの状態を取得する。
   *
   * 期待動作:
   * - リクエストで省略された秘密値は設定の既定値で補う。
   * - 有効なプロバイダが無ければ空の結果を返し、キャッシュには書き込まない。
   * - キャッシュが有効ならプロバイダへは問い合わせない。
   * - プロバイダ単位の失敗は UNKNOWN として結果に含まれ、例外にはならない。
   * - フィンガープリント・キャッシュ・並列実行自体の障害は StatusAggregationException を送出する。
   */
  public AggregationResult aggregate(CredentialSet requested, String rawTtlMinutes) {
    final CredentialSet credentials =
        (requested == null ? CredentialSet.empty() : requested).withDefaults(defaultCredentials);
    final List<ProviderId> enabled = credentials.enabledProviders();
    if (enabled.isEmpty()) {
      metrics.recordAggregateResult("empty");
      return AggregationResult.empty();
    }
    try {
      final String key = fingerprint.of(credentials);
      final Optional<List<ProviderStatus>> cached = cache.get(key);
      if (cached.isPresent()) {
        metrics.recordAggregateResult("cache_hit");
        logger.debug("status cache hit providers={}", enabled.size());
        return new AggregationResult(cached.get(), enabled);
      }
      final List<ProviderStatus> results = fanOut(credentials, enabled);
      cache.put(key, results, resolveTtl(rawTtlMinutes, cacheProperties.defaultTtlMinutes()));
      metrics.recordAggregateResult("fetched");
      return new AggregationResult(results, enabled);
    } catch (RuntimeException ex) {
      metrics.recordAggregateResult("error");
      logger.error("status aggregation failed providers={}", enabled.size(), ex);
      throw new StatusAggregationException("status aggregation failed", ex);
    }
  }

  private List<ProviderStatus> fanOut(CredentialSet credentials, List<ProviderId> enabled) {
    final String aggregationId = UUID.randomUUID().toString();
    final Map<String, String> callerContext = MDC.getCopyOfContextMap();
    MDC.put(MDC_AGGREGATION_ID, aggregationId);
    try {
      final List<CompletableFuture<ProviderStatus>> futures = new ArrayList<>();
      for (ProviderId provider : enabled) {
        final ProviderAdapter adapter = adapters.get(provider);
        if (adapter == null) {
          throw new IllegalStateException("no adapter registered for " + provider.tag());
        }
        futures.add(
            CompletableFuture.supplyAsync(
                () -> callAdapter(adapter, credentials, callerContext, aggregationId),
                providerExecutor));
      }
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
      logger.info("status fan-out completed providers={}", enabled.size());
      return futures.stream().map(CompletableFuture::join).toList();
    } catch (CompletionException ex) {
      throw new IllegalStateException("provider call failed unexpectedly", ex.getCause());
    } catch (RejectedExecutionException ex) {
      throw new IllegalStateException("provider executor rejected the call", ex);
    } finally {
      MDC.remove(MDC_AGGREGATION_ID);
    }
  }

  private ProviderStatus callAdapter(
      ProviderAdapter adapter,
      CredentialSet credentials,
      Map<String, String> callerContext,
      String aggregationId) {
    if (callerContext != null) {
      MDC.setContextMap(callerContext);
    }
    MDC.put(MDC_AGGREGATION_ID, aggregationId);
    final Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      final ProviderStatus status = adapter.fetchStatus(credentials);
      metrics.recordProviderCall(
          adapter.providerId().tag(),
          status.premiumState().name().toLowerCase(Locale.ROOT),
          stopwatch.elapsed());
      return status;
    } finally {
      MDC.clear();
    }
  }

  /**
   * 役割: 生の TTL 指定(分)を正規化する。
   * 動作: 数値として解釈できない・有限でない・未指定なら既定値、それ以外は小数を切り捨てて最小 1 分とする。
   * 極端に大きな値は MAX_TTL_MINUTES に丸める。
   */
  @VisibleForTesting
  static Duration resolveTtl(String raw, int defaultMinutes) {
    if (raw == null || raw.isBlank()) {
      return Duration.ofMinutes(defaultMinutes);
    }
    final double value;
    try {
      value = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      return Duration.ofMinutes(defaultMinutes);
    }
    if (!Double.isFinite(value)) {
      return Duration.ofMinutes(defaultMinutes);
    }
    final long minutes = (long) Math.floor(Math.min(value, MAX_TTL_MINUTES));
    return Duration.ofMinutes(Math.max(1L, minutes));
  }
}
