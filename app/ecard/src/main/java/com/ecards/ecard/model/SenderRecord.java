/*
 * Where: eCard domain model
 * What: Snapshot of one row of the senders table
 * Why: Email is the natural key that ties repeat senders to their cards
 */
package com.ecards.ecard.model;

import java.time.Instant;
import java.util.UUID;

public record SenderRecord(UUID senderId, String name, String email, Instant createdDate) {}
