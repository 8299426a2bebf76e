package com.ecards.ecard.api.request;

import com.ecards.ecard.model.PremadeTemplateRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplateRequest(
    @Size(max = 100) String templateId,
    @NotBlank @Size(max = 200) String name,
    @NotBlank @Size(max = 100) String category,
    @NotBlank @Size(max = 10) String iconEmoji,
    @Size(max = 1000) String description,
    @Size(max = 500) String imagePath,
    Boolean active,
    Integer sortOrder) {

  // absent flags default to an active template sorted first
  public PremadeTemplateRecord toRecord() {
    return new PremadeTemplateRecord(
        templateId,
        name,
        category,
        iconEmoji,
        description,
        imagePath,
        active == null || active,
        sortOrder == null ? 0 : sortOrder);
  }
}
