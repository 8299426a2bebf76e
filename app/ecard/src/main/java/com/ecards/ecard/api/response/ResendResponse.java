package com.ecards.ecard.api.response;

import com.ecards.ecard.model.ResendResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResendResponse(UUID cardId, Instant sentDate) {

  public static ResendResponse from(ResendResult result) {
    return new ResendResponse(result.cardId(), result.sentDate());
  }
}
