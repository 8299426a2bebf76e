package com.ecards.ecard.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class CardDeliveryWorkerTest {

  @Mock private CardDeliveryService deliveryService;

  @Test
  void deliveryRunFailureIsContained() {
    when(deliveryService.runDeliveryPass()).thenThrow(new IllegalStateException("boom"));

    assertThatCode(() -> new CardDeliveryWorker(deliveryService).run()).doesNotThrowAnyException();
    verify(deliveryService).runDeliveryPass();
    assertThat(MDC.get(CardRetentionWorker.RUN_ID_KEY)).isNull();
  }
}
