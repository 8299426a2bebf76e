/*
 * Where: eCard service layer
 * What: Records a recipient view and applies the first-view expiry rule
 * Why: Concurrent views must all be counted; the row lock serializes them
 */
package com.ecards.ecard.service;

import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.ViewContext;
import com.ecards.ecard.model.ViewRecord;
import com.ecards.ecard.repository.CardRepository;
import com.ecards.ecard.repository.ViewRecordRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CardViewService {

  private static final Logger logger = LoggerFactory.getLogger(CardViewService.class);

  static final int MAX_IP_ADDRESS_LENGTH = 45;
  static final int MAX_USER_AGENT_LENGTH = 500;

  private final CardRepository cardRepository;
  private final ViewRecordRepository viewRecordRepository;
  private final CardLifecyclePolicy lifecyclePolicy;
  private final CardMetrics metrics;
  private final Clock clock;

  /**
   * Appends a view record and bumps the counter. The first view also stamps {@code
   * firstViewedDate} and moves the expiry to the post-view window.
   *
   * @return the card as stored after this view
   * @throws CardNotFoundException when no card has the id
   */
  @Transactional
  public CardRecord recordView(UUID cardId, ViewContext context) {
    final CardRecord card =
        cardRepository
            .findByIdForUpdate(cardId)
            .orElseThrow(() -> new CardNotFoundException(cardId));
    final Instant now = Instant.now(clock);
    final ViewContext viewContext = context == null ? ViewContext.empty() : context;

    viewRecordRepository.insert(
        new ViewRecord(
            UUID.randomUUID(),
            cardId,
            now,
            truncate(viewContext.ipAddress(), MAX_IP_ADDRESS_LENGTH),
            truncate(viewContext.userAgent(), MAX_USER_AGENT_LENGTH)));

    final int viewCount = card.viewCount() + 1;
    Instant firstViewedDate = card.firstViewedDate();
    Instant expiryDate = card.expiryDate();
    if (firstViewedDate == null) {
      firstViewedDate = now;
      expiryDate = lifecyclePolicy.onFirstView(card.expiryDate(), now);
      logger.info(
          "ecard first view cardId={} previousExpiry={} expiry={}",
          cardId,
          card.expiryDate(),
          expiryDate);
    }
    cardRepository.updateViewState(cardId, viewCount, firstViewedDate, expiryDate);
    metrics.recordView();

    return new CardRecord(
        card.cardId(),
        card.senderId(),
        card.recipientName(),
        card.recipientEmail(),
        card.message(),
        card.customArtPath(),
        card.premadeArtId(),
        card.scheduledSendDate(),
        card.sent(),
        card.sentDate(),
        card.createdDate(),
        firstViewedDate,
        viewCount,
        expiryDate);
  }

  @VisibleForTesting
  static String truncate(String value, int maxLength) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.length() <= maxLength ? value : value.substring(0, maxLength);
  }
}
