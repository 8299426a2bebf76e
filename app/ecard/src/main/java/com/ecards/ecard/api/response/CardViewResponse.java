package com.ecards.ecard.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

// What the recipient sees when opening the link; no tracking fields beyond the count.
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CardViewResponse(
    UUID cardId,
    String appName,
    String recipientName,
    String message,
    String senderName,
    String senderEmail,
    String premadeArtId,
    String artUrl,
    int viewCount,
    Instant expiryDate) {}
