/*
 * Where: eCard configuration binding
 * What: Retention windows used when a card is created and first viewed
 * Why: Keeps the 14/30 day policy tunable per environment
 */
package com.ecards.ecard.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "ecard.lifecycle")
@Validated
public record CardLifecycleProperties(
    @NotNull @DefaultValue("30d") Duration scheduledRetention,
    @NotNull @DefaultValue("14d") Duration immediateRetention,
    @NotNull @DefaultValue("14d") Duration postViewRetention) {

  public static CardLifecycleProperties defaults() {
    return new CardLifecycleProperties(
        Duration.ofDays(30), Duration.ofDays(14), Duration.ofDays(14));
  }

  @AssertTrue(message = "ecard.lifecycle retention windows must be positive")
  public boolean isEveryWindowPositive() {
    return isPositive(scheduledRetention)
        && isPositive(immediateRetention)
        && isPositive(postViewRetention);
  }

  private boolean isPositive(Duration duration) {
    // null is reported by @NotNull
    return duration == null || (!duration.isZero() && !duration.isNegative());
  }
}
