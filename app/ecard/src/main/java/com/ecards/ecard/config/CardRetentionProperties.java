/*
 * Where: eCard configuration binding
 * What: Holds the retention sweep schedule
 * Why: Purge cadence differs between local runs and production
 */
package com.ecards.ecard.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ecard.retention")
public record CardRetentionProperties(
    boolean enabled, Duration initialDelay, Duration sweepInterval) {}
