package com.statusio.aggregator;

import com.statusio.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@Import(TimeConfig.class)
@RestController
public class StatusAggregatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(StatusAggregatorApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "status-aggregator: ok";
  }
}
