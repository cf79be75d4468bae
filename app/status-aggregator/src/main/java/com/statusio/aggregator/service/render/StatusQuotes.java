/*
 * どこで: Status Aggregator 描画層
 * 何を: 残日数の区分ごとに表示用の一言を選ぶ
 * なぜ: 期限が近いほど更新を促す文言へ切り替えるため
 */
package com.statusio.aggregator.service.render;

import com.statusio.aggregator.model.StatusBucket;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Component;

@Component
public class StatusQuotes {

  private static final Map<StatusBucket, List<String>> QUOTES = new EnumMap<>(StatusBucket.class);

  static {
    QUOTES.put(
        StatusBucket.OK,
        List.of(
            "Grind & binge",
            "Work n' watch",
            "Emails? Nah, episodes",
            "Plot twist: me",
            "Popcorn is needed",
            "Credits? Nope. Next.",
            "Plot armor ON",
            "Main quest: relax.",
            "Side quest: popcorn.",
            "Stretch, sip, stream.",
            "Just one season. *Lies.*",
            "Oops, next ep autoplays",
            "My cardio: skipping intros",
            "Binge now, adult later"));
    QUOTES.put(
        StatusBucket.WARNING,
        List.of(
            "Renew before cliffhanger.",
            "Cheaper than snacks.",
            "Tiny fee, huge chill.",
            "Your future self says thanks.",
            "Renew now, binge later.",
            "Don’t pause the fun.",
            "Click. Renew. Continue.",
            "Keep calm, renew on.",
            "Couch demands tribute",
            "Renewal = plot armor"));
    QUOTES.put(
        StatusBucket.CRITICAL,
        List.of(
            "Boss fight: renewal.",
            "Renew soon, it's coming!",
            "Your time is almost up!",
            "Two taps, all vibes.",
            "Don’t lose the finale.",
            "3…2…renew.",
            "Grab the lifeline.",
            "Save the weekend.",
            "Clock’s loud. Renew.",
            "Plot armor expiring"));
    QUOTES.put(
        StatusBucket.EXPIRED,
        List.of(
            "Renew ASAP or else...",
            "Renew subscription to continue",
            "Renew now to continue",
            "We pause respectfully.",
            "Refill the fun meter.",
            "Next ep awaits payment.",
            "Fix the sub, then binge.",
            "Buffering… forever",
            "Paywall won. You lost.",
            "You had one job: renew"));
  }

  private final RandomGenerator random;

  public StatusQuotes(RandomGenerator quoteRandom) {
    this.random = quoteRandom;
  }

  public String quoteFor(StatusBucket bucket) {
    final List<String> candidates = quotesFor(bucket);
    return candidates.get(random.nextInt(candidates.size()));
  }

  static List<String> quotesFor(StatusBucket bucket) {
    return QUOTES.get(bucket);
  }
}
