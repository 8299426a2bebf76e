package com.ecards.ecard.api.response;

import com.ecards.ecard.model.PremadeTemplateRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplateResponse(
    String templateId,
    String name,
    String category,
    String iconEmoji,
    String description,
    String imagePath,
    boolean active,
    int sortOrder) {

  public static TemplateResponse from(PremadeTemplateRecord template) {
    return new TemplateResponse(
        template.templateId(),
        template.name(),
        template.category(),
        template.iconEmoji(),
        template.description(),
        template.imagePath(),
        template.active(),
        template.sortOrder());
  }
}
