package com.ecards.ecard.api.response;

import com.ecards.ecard.model.ViewRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ViewRecordResponse(
    UUID viewId, UUID cardId, Instant viewedDate, String ipAddress, String userAgent) {

  public static ViewRecordResponse from(ViewRecord view) {
    return new ViewRecordResponse(
        view.viewId(), view.cardId(), view.viewedDate(), view.ipAddress(), view.userAgent());
  }
}
