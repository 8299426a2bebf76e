/*
 * Where: eCard service layer
 * What: Records delivery, retention and view metrics
 * Why: Lets the delivery backlog and purge volume be watched from Prometheus
 */
package com.ecards.ecard.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class CardMetrics {

  public static final String RESULT_SENT = "sent";
  public static final String RESULT_FAILED = "failed";

  private static final String METRIC_DELIVERY_TOTAL = "ecard.delivery.total";
  private static final String METRIC_DELIVERY_BACKLOG = "ecard.delivery.backlog.current";
  private static final String METRIC_RETENTION_PURGED = "ecard.retention.purged.total";
  private static final String METRIC_RETENTION_ARTWORK_FAILURES =
      "ecard.retention.artwork_failures.total";
  private static final String METRIC_VIEW_TOTAL = "ecard.view.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger deliveryBacklog = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter purgedCounter;
  private final Counter artworkFailureCounter;
  private final Counter viewCounter;

  public CardMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_DELIVERY_BACKLOG, deliveryBacklog, AtomicInteger::get)
        .description("Cards due for delivery at the start of the last pass")
        .register(meterRegistry);
    this.purgedCounter =
        Counter.builder(METRIC_RETENTION_PURGED)
            .description("Cards removed by the retention sweep")
            .register(meterRegistry);
    this.artworkFailureCounter =
        Counter.builder(METRIC_RETENTION_ARTWORK_FAILURES)
            .description("Artwork files that could not be deleted")
            .register(meterRegistry);
    this.viewCounter =
        Counter.builder(METRIC_VIEW_TOTAL)
            .description("Recorded card views")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Card delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void updateDeliveryBacklog(int backlog) {
    deliveryBacklog.set(Math.max(backlog, 0));
  }

  public void recordPurged(int count) {
    if (count > 0) {
      purgedCounter.increment(count);
    }
  }

  public void recordArtworkFailure() {
    artworkFailureCounter.increment();
  }

  public void recordView() {
    viewCounter.increment();
  }
}
