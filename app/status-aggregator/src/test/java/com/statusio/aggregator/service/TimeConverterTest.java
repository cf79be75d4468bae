/*
 * どこで: Status Aggregator サービス層テスト
 * 何を: epoch 秒・残り秒数から残日数への変換と切り上げ規則を検証する
 * なぜ: 残り 1 秒でも 1 日と数える丸めや不正値の扱いが退行しないようにするため
 */
package com.statusio.aggregator.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.statusio.aggregator.model.RemainingTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TimeConverterTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
  private final TimeConverter converter = new TimeConverter(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void absoluteEpochRoundsUp() {
    final RemainingTime remaining = converter.fromAbsoluteEpoch(NOW.getEpochSecond() + 1);

    assertThat(remaining.daysRemaining()).isEqualTo(1L);
    assertThat(remaining.expiresAt()).isEqualTo(NOW.plusSeconds(1));
  }

  @Test
  void absoluteEpochExactDays() {
    final RemainingTime remaining =
        converter.fromAbsoluteEpoch(NOW.getEpochSecond() + 7 * 86_400);

    assertThat(remaining.daysRemaining()).isEqualTo(7L);
  }

  @Test
  void pastOrInvalidEpochIsNone() {
    assertThat(converter.fromAbsoluteEpoch(NOW.getEpochSecond())).isEqualTo(RemainingTime.none());
    assertThat(converter.fromAbsoluteEpoch(NOW.getEpochSecond() - 10))
        .isEqualTo(RemainingTime.none());
    assertThat(converter.fromAbsoluteEpoch(0)).isEqualTo(RemainingTime.none());
    assertThat(converter.fromAbsoluteEpoch(-5)).isEqualTo(RemainingTime.none());
    assertThat(converter.fromAbsoluteEpoch(Double.NaN)).isEqualTo(RemainingTime.none());
    assertThat(converter.fromAbsoluteEpoch(Double.POSITIVE_INFINITY))
        .isEqualTo(RemainingTime.none());
  }

  @Test
  void durationRoundsUpAndSetsExpiry() {
    final RemainingTime remaining = converter.fromDuration(86_401);

    assertThat(remaining.daysRemaining()).isEqualTo(2L);
    assertThat(remaining.expiresAt()).isEqualTo(NOW.plusSeconds(86_401));
  }

  @Test
  void fractionalDurationStillCountsOneDay() {
    final RemainingTime remaining = converter.fromDuration(0.5);

    assertThat(remaining.daysRemaining()).isEqualTo(1L);
    assertThat(remaining.expiresAt()).isAfter(NOW);
  }

  @Test
  void invalidDurationIsNone() {
    assertThat(converter.fromDuration(0)).isEqualTo(RemainingTime.none());
    assertThat(converter.fromDuration(-1)).isEqualTo(RemainingTime.none());
    assertThat(converter.fromDuration(Double.NaN)).isEqualTo(RemainingTime.none());
  }

  @Test
  void farFutureEpochDoesNotOverflow() {
    final RemainingTime remaining = converter.fromAbsoluteEpoch(1e300);

    assertThat(remaining.hasTimeLeft()).isTrue();
  }

  @Test
  void instantBeforeNowIsNone() {
    assertThat(converter.fromInstant(NOW.minusSeconds(1))).isEqualTo(RemainingTime.none());
    assertThat(converter.fromInstant(null)).isEqualTo(RemainingTime.none());
  }
}
