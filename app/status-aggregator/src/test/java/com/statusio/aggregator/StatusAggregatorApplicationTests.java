package com.statusio.aggregator;

import static org.assertj.core.api.Assertions.assertThat;

import com.statusio.aggregator.provider.ProviderAdapter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class StatusAggregatorApplicationTests {

  @Autowired private List<ProviderAdapter> adapters;

  @Test
  void contextLoadsWithAllProviderAdapters() {
    assertThat(adapters).hasSize(5);
  }
}
