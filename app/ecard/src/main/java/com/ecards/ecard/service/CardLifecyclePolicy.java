/*
 * Where: eCard service layer
 * What: Computes send schedule and expiry for a card at creation and on first view
 * Why: The retention sweeper and delivery scheduler both act on the dates decided here
 */
package com.ecards.ecard.service;

import com.ecards.ecard.config.CardLifecycleProperties;
import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.CardSchedule;
import java.time.Instant;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Pure date arithmetic over the configured retention windows.
 *
 * <p>A card without a requested send date is due immediately and lives for the immediate window
 * (14 days by default). A card with a requested date lives for the scheduled window (30 days by
 * default) counted from creation, whatever the requested date is. The first view replaces the
 * expiry with the post-view window counted from the view.
 */
@Component
@RequiredArgsConstructor
public class CardLifecyclePolicy {

  private final CardLifecycleProperties properties;

  public CardSchedule computeInitialSchedule(Instant scheduledSendDate, Instant createdAt) {
    Objects.requireNonNull(createdAt, "createdAt");
    if (scheduledSendDate != null) {
      return new CardSchedule(scheduledSendDate, createdAt.plus(properties.scheduledRetention()));
    }
    return new CardSchedule(createdAt, createdAt.plus(properties.immediateRetention()));
  }

  /**
   * Expiry after the first recorded view. Callers invoke this only while the card has no first
   * view yet, so the result may be earlier than the current expiry.
   */
  public Instant onFirstView(Instant currentExpiry, Instant viewedAt) {
    Objects.requireNonNull(viewedAt, "viewedAt");
    return viewedAt.plus(properties.postViewRetention());
  }

  public boolean isExpired(CardRecord card, Instant now) {
    return !now.isBefore(card.expiryDate());
  }

  public boolean isDueForDelivery(CardRecord card, Instant now) {
    return !card.sent()
        && card.scheduledSendDate() != null
        && !card.scheduledSendDate().isAfter(now);
  }
}
