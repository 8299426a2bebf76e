/*
 * Where: eCard domain model
 * What: One immutable entry of the view audit trail
 * Why: Rows are only inserted and are removed by cascade with their card
 */
package com.ecards.ecard.model;

import java.time.Instant;
import java.util.UUID;

public record ViewRecord(
    UUID viewId, UUID cardId, Instant viewedDate, String ipAddress, String userAgent) {}
