package com.ecards.ecard.model;

import java.time.Instant;

public record CreateCardCommand(
    String recipientName,
    String recipientEmail,
    String message,
    Instant scheduledSendDate,
    String premadeArtId) {}
