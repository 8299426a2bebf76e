/*
 * Where: eCard retention worker
 * What: Triggers the retention sweep on a fixed delay
 * Why: Purging must not depend on requests hitting the service
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
    name = "ecard.retention.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class CardRetentionWorker {

  private static final Logger logger = LoggerFactory.getLogger(CardRetentionWorker.class);
  static final String RUN_ID_KEY = "run_id";

  private final CardRetentionService retentionService;

  @Scheduled(
      initialDelayString = "${ecard.retention.initial-delay}",
      fixedDelayString = "${ecard.retention.sweep-interval}")
  public void run() {
    MDC.put(RUN_ID_KEY, RunIds.newRunId());
    try {
      retentionService.runRetentionSweep();
    } catch (RuntimeException ex) {
      // the next interval retries the whole sweep
      logger.error("card retention sweep failed", ex);
    } finally {
      MDC.remove(RUN_ID_KEY);
    }
  }
}
