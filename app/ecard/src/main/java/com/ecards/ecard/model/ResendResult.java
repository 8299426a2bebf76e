package com.ecards.ecard.model;

import java.time.Instant;
import java.util.UUID;

public record ResendResult(UUID cardId, Instant sentDate) {}
