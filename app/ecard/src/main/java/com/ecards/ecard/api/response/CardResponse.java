/*
 * Where: eCard API response DTO
 * What: Card as shown to its sender and to operators
 * Why: The artwork file path stays server-side; only its presence is exposed
 */
package com.ecards.ecard.api.response;

import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.CardWithSender;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CardResponse(
    UUID cardId,
    String recipientName,
    String recipientEmail,
    String message,
    String premadeArtId,
    boolean hasCustomArt,
    Instant scheduledSendDate,
    boolean sent,
    Instant sentDate,
    Instant createdDate,
    Instant firstViewedDate,
    int viewCount,
    Instant expiryDate,
    SenderSummary sender) {

  public static CardResponse from(CardRecord card) {
    return from(card, null);
  }

  public static CardResponse from(CardWithSender item) {
    return from(item.card(), SenderSummary.from(item.sender()));
  }

  private static CardResponse from(CardRecord card, SenderSummary sender) {
    return new CardResponse(
        card.cardId(),
        card.recipientName(),
        card.recipientEmail(),
        card.message(),
        card.premadeArtId(),
        card.hasCustomArt(),
        card.scheduledSendDate(),
        card.sent(),
        card.sentDate(),
        card.createdDate(),
        card.firstViewedDate(),
        card.viewCount(),
        card.expiryDate(),
        sender);
  }
}
