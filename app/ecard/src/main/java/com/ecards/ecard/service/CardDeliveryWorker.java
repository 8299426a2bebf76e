/*
 * Where: eCard delivery worker
 * What: Triggers the delivery pass on a fixed delay
 */
package com.ecards.ecard.service;

import com.ecards.common.RunIds;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "ecard.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class CardDeliveryWorker {

  private static final Logger logger = LoggerFactory.getLogger(CardDeliveryWorker.class);

  private final CardDeliveryService deliveryService;

  @Scheduled(
      initialDelayString = "${ecard.delivery.initial-delay}",
      fixedDelayString = "${ecard.delivery.poll-interval}")
  public void run() {
    MDC.put(CardRetentionWorker.RUN_ID_KEY, RunIds.newRunId());
    try {
      deliveryService.runDeliveryPass();
    } catch (RuntimeException ex) {
      logger.error("card delivery pass failed", ex);
    } finally {
      MDC.remove(CardRetentionWorker.RUN_ID_KEY);
    }
  }
}
