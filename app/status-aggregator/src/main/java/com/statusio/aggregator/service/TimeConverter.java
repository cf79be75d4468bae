/*
 * どこで: Status Aggregator サービス層
 * 何を: プロバイダ固有の時刻表現(絶対 epoch 秒/残り秒数)を残日数と失効時刻へ変換する
 * なぜ: 時刻単位の違いをアダプタから切り離し、日数の丸め方を一箇所で固定するため
 */
package com.statusio.aggregator.service;

import com.statusio.aggregator.model.RemainingTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 日数は常に切り上げる。残り 1 秒でも「残り 1 日」と報告し、期限前の利用者に失効済みと表示しない。
 */
@Component
@RequiredArgsConstructor
public class TimeConverter {

  static final long SECONDS_PER_DAY = 86_400L;
  static final long MILLIS_PER_DAY = SECONDS_PER_DAY * 1000L;
  // ミリ秒で表現できる最遠の時刻。これより先は同じ時刻として扱う。
  private static final Instant LATEST = Instant.ofEpochMilli(Long.MAX_VALUE);

  private final Clock clock;

  /**
   * 役割: 絶対 epoch 秒を残日数へ変換する。
   * 動作: 有限の正数でない、または現在以前の時刻なら {0, なし} を返す。
   */
  public RemainingTime fromAbsoluteEpoch(double epochSeconds) {
    if (!isFinitePositive(epochSeconds)) {
      return RemainingTime.none();
    }
    return fromInstant(toInstant(epochSeconds));
  }

  /** 日付文字列などから解析済みの失効時刻に対して epoch 秒と同じ規則を適用する。 */
  public RemainingTime fromInstant(Instant expiresAt) {
    if (expiresAt == null) {
      return RemainingTime.none();
    }
    final Instant bounded = expiresAt.isAfter(LATEST) ? LATEST : expiresAt;
    final long remainingMillis = Duration.between(Instant.now(clock), bounded).toMillis();
    if (remainingMillis <= 0) {
      return RemainingTime.none();
    }
    return new RemainingTime(ceilDays(remainingMillis), expiresAt);
  }

  /**
   * 役割: 現在からの残り秒数を残日数と失効時刻へ変換する。
   * 動作: 有限の正数でなければ {0, なし} を返す。失効時刻は now + seconds。
   */
  public RemainingTime fromDuration(double seconds) {
    if (!isFinitePositive(seconds)) {
      return RemainingTime.none();
    }
    final long days = (long) Math.ceil(seconds / SECONDS_PER_DAY);
    return new RemainingTime(days, plusSecondsSaturated(Instant.now(clock), seconds));
  }

  private static long ceilDays(long millis) {
    return Math.max(0L, -Math.floorDiv(-millis, MILLIS_PER_DAY));
  }

  private static Instant toInstant(double epochSeconds) {
    final double millis = Math.floor(epochSeconds * 1000d);
    if (millis >= (double) Long.MAX_VALUE) {
      return LATEST;
    }
    return Instant.ofEpochMilli((long) millis);
  }

  private static Instant plusSecondsSaturated(Instant now, double seconds) {
    final double limit = (double) (LATEST.getEpochSecond() - now.getEpochSecond());
    if (seconds >= limit) {
      return LATEST;
    }
    final long wholeSeconds = (long) Math.floor(seconds);
    final long nanos = (long) Math.ceil((seconds - wholeSeconds) * 1_000_000_000d);
    return now.plusSeconds(wholeSeconds).plusNanos(nanos);
  }

  private static boolean isFinitePositive(double value) {
    return Double.isFinite(value) && value > 0;
  }
}
