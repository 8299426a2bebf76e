package com.ecards.ecard.model;

import java.time.Instant;

/** Effective send date and expiry computed for a new card. */
public record CardSchedule(Instant scheduledSendDate, Instant expiryDate) {}
