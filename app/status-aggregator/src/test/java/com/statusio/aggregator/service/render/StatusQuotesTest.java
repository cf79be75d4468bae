package com.statusio.aggregator.service.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.statusio.aggregator.model.StatusBucket;
import java.util.random.RandomGenerator;
import org.junit.jupiter.api.Test;

class StatusQuotesTest {

  @Test
  void everyBucketHasQuotes() {
    for (StatusBucket bucket : StatusBucket.values()) {
      assertThat(StatusQuotes.quotesFor(bucket)).isNotEmpty();
    }
  }

  @Test
  void quoteIsPickedFromBucketTableWithInjectedRandom() {
    final RandomGenerator random = mock(RandomGenerator.class);
    when(random.nextInt(anyInt())).thenReturn(1);
    final StatusQuotes quotes = new StatusQuotes(random);

    assertThat(quotes.quoteFor(StatusBucket.EXPIRED))
        .isEqualTo(StatusQuotes.quotesFor(StatusBucket.EXPIRED).get(1));
  }

  @Test
  void defaultRandomStaysWithinTable() {
    final StatusQuotes quotes = new StatusQuotes(RandomGenerator.getDefault());

    for (int i = 0; i < 50; i++) {
      assertThat(StatusQuotes.quotesFor(StatusBucket.WARNING))
          .contains(quotes.quoteFor(StatusBucket.WARNING));
    }
  }
}
