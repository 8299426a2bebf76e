/*
 * Where: common configuration
 * What: Exposes the Clock used by every service and worker
 * Why: Tests replace it with a fixed clock to pin expiry and schedule boundaries
 */
package com.ecards.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
