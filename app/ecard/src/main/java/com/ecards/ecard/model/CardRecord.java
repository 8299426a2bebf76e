/*
 * Where: eCard domain model
 * What: Snapshot of one row of the cards table
 * Why: Shared by the request path and both background workers
 */
package com.ecards.ecard.model;

import java.time.Instant;
import java.util.UUID;

public record CardRecord(
    UUID cardId,
    UUID senderId,
    String recipientName,
    String recipientEmail,
    String message,
    String customArtPath,
    String premadeArtId,
    Instant scheduledSendDate,
    boolean sent,
    Instant sentDate,
    Instant createdDate,
    Instant firstViewedDate,
    int viewCount,
    Instant expiryDate) {

  public boolean hasCustomArt() {
    return customArtPath != null && !customArtPath.isBlank();
  }
}
