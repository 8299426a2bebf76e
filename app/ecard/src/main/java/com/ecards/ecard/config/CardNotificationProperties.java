/*
 * Where: eCard configuration binding
 * What: Branding, link and mail sender settings for recipient notifications
 * Why: A missing frontend URL would produce unusable view links, so it fails startup
 */
package com.ecards.ecard.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "ecard.notification")
@Validated
public record CardNotificationProperties(
    @NotBlank @DefaultValue("eCards") String appName,
    @NotBlank String frontendUrl,
    @NotBlank @DefaultValue("ecard-notification") String templateName,
    @DefaultValue("false") boolean mailEnabled,
    @NotBlank @DefaultValue("noreply@example.com") String fromEmail,
    String fromName) {

  public String resolvedFromName() {
    return fromName == null || fromName.isBlank() ? appName : fromName;
  }

  public String viewUrl(Object cardId) {
    final String base =
        frontendUrl.endsWith("/") ? frontendUrl.substring(0, frontendUrl.length() - 1) : frontendUrl;
    return base + "/view/" + cardId;
  }
}
