/*
 * どこで: Status Aggregator ドメインモデル
 * 何を: 1 プロバイダ分の正規化済みサブスクリプション状態を表現する
 * なぜ: プロバイダごとに異なる応答形式を単一の形へ揃えて集約・描画するため
 */
package com.statusio.aggregator.model;

import java.time.Instant;

/**
 * 正規化済みのプロバイダ状態。
 *
 * <p>不変条件:
 *
 * <ul>
 *   <li>UNKNOWN のとき daysRemaining/expiresAt は null で、diagnostic に理由を持つ。
 *   <li>INACTIVE のとき daysRemaining は 0、expiresAt は null。
 *   <li>ACTIVE のとき daysRemaining は null(残り期間不明)または 0 以上。
 * </ul>
 */
public record ProviderStatus(
    String providerName,
    PremiumState premiumState,
    Long daysRemaining,
    Instant expiresAt,
    String accountId,
    String diagnostic) {

  public ProviderStatus {
    if (providerName == null || providerName.isBlank()) {
      throw new IllegalArgumentException("providerName is required");
    }
    if (premiumState == null) {
      throw new IllegalArgumentException("premiumState is required");
    }
    switch (premiumState) {
      case UNKNOWN -> {
        if (daysRemaining != null || expiresAt != null) {
          throw new IllegalArgumentException("unknown status must not carry remaining time");
        }
        if (diagnostic == null || diagnostic.isBlank()) {
          throw new IllegalArgumentException("unknown status requires a diagnostic");
        }
      }
      case INACTIVE -> {
        if (daysRemaining == null || daysRemaining != 0 || expiresAt != null) {
          throw new IllegalArgumentException("inactive status must have zero days and no expiry");
        }
      }
      case ACTIVE -> {
        if (daysRemaining != null && daysRemaining < 0) {
          throw new IllegalArgumentException("daysRemaining must not be negative");
        }
      }
    }
  }

  /** remaining が null の場合は残り期間不明の ACTIVE とする。 */
  public static ProviderStatus active(
      ProviderId provider, RemainingTime remaining, String accountId) {
    if (remaining == null) {
      return new ProviderStatus(
          provider.displayName(), PremiumState.ACTIVE, null, null, accountId, null);
    }
    return new ProviderStatus(
        provider.displayName(),
        PremiumState.ACTIVE,
        remaining.daysRemaining(),
        remaining.expiresAt(),
        accountId,
        null);
  }

  public static ProviderStatus inactive(ProviderId provider, String accountId, String diagnostic) {
    return new ProviderStatus(
        provider.displayName(), PremiumState.INACTIVE, 0L, null, accountId, diagnostic);
  }

  public static ProviderStatus unknown(ProviderId provider, String accountId, String diagnostic) {
    return new ProviderStatus(
        provider.displayName(), PremiumState.UNKNOWN, null, null, accountId, diagnostic);
  }

  public boolean isKnown() {
    return premiumState != PremiumState.UNKNOWN;
  }

  public boolean hasAccountId() {
    return accountId != null && !accountId.isBlank();
  }
}
