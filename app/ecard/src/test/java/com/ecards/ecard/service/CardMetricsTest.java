package com.ecards.ecard.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class CardMetricsTest {

  @Test
  void recordsDeliveryRetentionAndViewMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CardMetrics metrics = new CardMetrics(registry);

    metrics.recordDeliveryResult(CardMetrics.RESULT_SENT);
    metrics.recordDeliveryResult(CardMetrics.RESULT_SENT);
    metrics.recordDeliveryResult(CardMetrics.RESULT_FAILED);
    metrics.updateDeliveryBacklog(7);
    metrics.recordPurged(3);
    metrics.recordPurged(0);
    metrics.recordArtworkFailure();
    metrics.recordView();

    assertThat(registry.get("ecard.delivery.total").tag("result", "sent").counter().count())
        .isEqualTo(2.0d);
    assertThat(registry.get("ecard.delivery.total").tag("result", "failed").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("ecard.delivery.backlog.current").gauge().value()).isEqualTo(7.0d);
    assertThat(registry.get("ecard.retention.purged.total").counter().count()).isEqualTo(3.0d);
    assertThat(registry.get("ecard.retention.artwork_failures.total").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("ecard.view.total").counter().count()).isEqualTo(1.0d);
  }

  @Test
  void negativeBacklogIsReportedAsZero() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CardMetrics metrics = new CardMetrics(registry);

    metrics.updateDeliveryBacklog(-1);

    assertThat(registry.get("ecard.delivery.backlog.current").gauge().value()).isZero();
  }
}
