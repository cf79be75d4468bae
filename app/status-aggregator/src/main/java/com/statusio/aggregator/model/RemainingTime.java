/*
 * どこで: Status Aggregator ドメインモデル
 * 何を: 正規化済みの残日数と失効時刻の組を表現する
 * なぜ: epoch 形式と残秒数形式のどちらからでも同じ形で扱うため
 */
package com.statusio.aggregator.model;

import java.time.Instant;

public record RemainingTime(long daysRemaining, Instant expiresAt) {

  private static final RemainingTime NONE = new RemainingTime(0, null);

  public RemainingTime {
    if (daysRemaining < 0) {
      throw new IllegalArgumentException("daysRemaining must not be negative");
    }
  }

  public static RemainingTime none() {
    return NONE;
  }

  public boolean hasTimeLeft() {
    return daysRemaining > 0;
  }
}
