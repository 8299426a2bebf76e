/*
 * Where: eCard API request DTO
 * What: JSON part of the multipart create-card request
 */
package com.ecards.ecard.api.request;

import com.ecards.ecard.model.CreateCardCommand;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateCardRequest(
    @NotBlank @Size(max = 200) String recipientName,
    @NotBlank @Email @Size(max = 200) String recipientEmail,
    @NotBlank @Size(max = 2000) String message,
    Instant scheduledSendDate,
    @Size(max = 100) String premadeArtId) {

  public CreateCardCommand toCommand() {
    return new CreateCardCommand(
        recipientName, recipientEmail, message, scheduledSendDate, premadeArtId);
  }
}
