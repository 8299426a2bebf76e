/*
 * Where: eCard notification
 * What: Wraps the active sender and fails deliveries to selected recipients
 * Why: Reproduces "left unsent and retried next pass" end to end without a broken SMTP server
 */
package com.ecards.ecard.notification;

import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.SenderRecord;

/** Registered by {@link FailureInjectionConfig} only; never a component of its own. */
public class FailureInjectingNotificationSender implements NotificationSender {

  private final NotificationSender delegate;
  private final String recipientEmailPrefix;

  public FailureInjectingNotificationSender(
      NotificationSender delegate, String recipientEmailPrefix) {
    this.delegate = delegate;
    this.recipientEmailPrefix = recipientEmailPrefix == null ? "" : recipientEmailPrefix.strip();
  }

  @Override
  public void send(CardRecord card, SenderRecord sender) {
    if (matches(card.recipientEmail())) {
      throw new IllegalStateException(
          "ecard delivery failure injected for recipient=" + card.recipientEmail());
    }
    delegate.send(card, sender);
  }

  NotificationSender delegate() {
    return delegate;
  }

  private boolean matches(String recipientEmail) {
    return !recipientEmailPrefix.isEmpty()
        && recipientEmail != null
        && recipientEmail.startsWith(recipientEmailPrefix);
  }
}
