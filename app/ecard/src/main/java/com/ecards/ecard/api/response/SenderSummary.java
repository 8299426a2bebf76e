package com.ecards.ecard.api.response;

import com.ecards.ecard.model.SenderRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SenderSummary(UUID senderId, String name, String email) {

  public static SenderSummary from(SenderRecord sender) {
    return new SenderSummary(sender.senderId(), sender.name(), sender.email());
  }
}
