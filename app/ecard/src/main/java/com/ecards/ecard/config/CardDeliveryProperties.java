/*
 * Where: eCard configuration binding
 * What: Holds the delivery pass schedule
 * Why: Poll cadence is an operational knob, not a code constant
 */
package com.ecards.ecard.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ecard.delivery")
public record CardDeliveryProperties(
    boolean enabled, Duration initialDelay, Duration pollInterval) {}
