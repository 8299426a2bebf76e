package com.ecards.ecard.notification;

public class NotificationTemplateException extends RuntimeException {

  public NotificationTemplateException(String message) {
    super(message);
  }

  public NotificationTemplateException(String message, Throwable cause) {
    super(message, cause);
  }
}
