package com.ecards.ecard.notification;

public record RenderedNotification(String subject, String htmlBody, String textBody) {

  public boolean hasTextBody() {
    return textBody != null && !textBody.isBlank();
  }
}
