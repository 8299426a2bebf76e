/*
 * Where: eCard service layer
 * What: Sends notifications for cards whose send date has arrived
 * Why: A card is marked sent only after its notification was handed off
 */
package com.ecards.ecard.service;

import com.ecards.ecard.model.CardWithSender;
import com.ecards.ecard.notification.NotificationSender;
import com.ecards.ecard.repository.CardRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One delivery pass: due cards are sent one by one, failures stay unsent and are picked up again by
 * the next pass, and all successes are persisted together at the end. The send is never inside a
 * database transaction.
 */
@Service
@RequiredArgsConstructor
public class CardDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(CardDeliveryService.class);

  private final CardRepository cardRepository;
  private final NotificationSender notificationSender;
  private final CardMetrics metrics;
  private final WorkerShutdownSignal shutdownSignal;
  private final Clock clock;

  public DeliveryPassResult runDeliveryPass() {
    final Instant now = Instant.now(clock);
    final List<CardWithSender> due = cardRepository.findDueForDelivery(now);
    metrics.updateDeliveryBacklog(due.size());
    if (due.isEmpty()) {
      logger.debug("card delivery pass found no due cards now={}", now);
      return DeliveryPassResult.empty();
    }

    final Map<UUID, Instant> sentDates = new LinkedHashMap<>();
    int failed = 0;
    for (CardWithSender item : due) {
      if (shutdownSignal.isStopping()) {
        logger.info(
            "card delivery pass interrupted by shutdown sent={} remaining={}",
            sentDates.size(),
            due.size() - sentDates.size() - failed);
        break;
      }
      final UUID cardId = item.card().cardId();
      try {
        notificationSender.send(item.card(), item.sender());
        sentDates.put(cardId, Instant.now(clock));
        metrics.recordDeliveryResult(CardMetrics.RESULT_SENT);
      } catch (RuntimeException ex) {
        failed++;
        metrics.recordDeliveryResult(CardMetrics.RESULT_FAILED);
        logger.error(
            "card delivery failed cardId={} recipient={}",
            cardId,
            item.card().recipientEmail(),
            ex);
      }
    }

    final int marked = cardRepository.markSentBatch(sentDates);
    if (marked < sentDates.size()) {
      // purged or already marked by someone else since selection
      logger.warn(
          "card delivery marked fewer cards than sent sent={} marked={}", sentDates.size(), marked);
    }
    logger.info(
        "card delivery pass finished selected={} sent={} failed={} marked={}",
        due.size(),
        sentDates.size(),
        failed,
        marked);
    return new DeliveryPassResult(due.size(), sentDates.size(), failed, marked);
  }
}
