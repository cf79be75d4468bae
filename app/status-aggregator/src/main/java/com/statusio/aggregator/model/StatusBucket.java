/*
 * どこで: Status Aggregator ドメインモデル
 * 何を: 残日数を 4 段階の深刻度へ分類する
 * なぜ: 表示層がプロバイダ横断で最も悪い状態を判定できるようにするため
 */
package com.statusio.aggregator.model;

import java.util.List;

public enum StatusBucket {
  EXPIRED,
  CRITICAL,
  WARNING,
  OK;

  /** 期限不明の ACTIVE を実質無期限として扱うための番兵値。 */
  public static final long UNBOUNDED_DAYS = 9999L;

  static final long CRITICAL_MAX_DAYS = 3L;
  static final long WARNING_MAX_DAYS = 14L;

  public static StatusBucket classify(long days) {
    if (days <= 0) {
      return EXPIRED;
    }
    if (days <= CRITICAL_MAX_DAYS) {
      return CRITICAL;
    }
    if (days <= WARNING_MAX_DAYS) {
      return WARNING;
    }
    return OK;
  }

  /**
   * 役割: 分類に使う日数を決める。
   * 動作: daysRemaining があればその値、無ければ INACTIVE は 0、ACTIVE と UNKNOWN は番兵値とする。
   * 状態不明は失効の根拠にならないため最良側に寄せる。
   */
  public static long effectiveDays(ProviderStatus status) {
    if (status.daysRemaining() != null) {
      return status.daysRemaining();
    }
    return status.premiumState() == PremiumState.INACTIVE ? 0L : UNBOUNDED_DAYS;
  }

  public static StatusBucket of(ProviderStatus status) {
    return classify(effectiveDays(status));
  }

  /**
   * 役割: 集約結果全体で最も悪いバケットを返す。
   * 動作: 状態不明かつアカウント情報も無い結果は判定から除外し、対象が無ければ OK とする。
   */
  public static StatusBucket worst(List<ProviderStatus> results) {
    long worstDays = UNBOUNDED_DAYS;
    for (ProviderStatus status : results) {
      if (!isDisplayable(status)) {
        continue;
      }
      worstDays = Math.min(worstDays, effectiveDays(status));
    }
    return classify(worstDays);
  }

  public static boolean isDisplayable(ProviderStatus status) {
    return status.isKnown() || status.hasAccountId();
  }
}
