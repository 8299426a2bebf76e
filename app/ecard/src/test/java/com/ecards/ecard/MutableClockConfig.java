package com.ecards.ecard;

import java.time.Instant;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/** Replaces the system clock so integration tests can step through card lifetimes. */
@TestConfiguration(proxyBeanMethods = false)
public class MutableClockConfig {

  public static final Instant START = Instant.parse("2025-03-01T10:00:00Z");

  @Bean
  @Primary
  MutableClock testClock() {
    return new MutableClock(START);
  }
}
