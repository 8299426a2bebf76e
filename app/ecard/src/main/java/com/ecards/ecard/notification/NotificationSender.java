/*
 * Where: eCard notification
 * What: Sends the "you received a card" message to the recipient
 * Why: Delivery scheduler and resend share one seam that tests can replace
 */
package com.ecards.ecard.notification;

import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.SenderRecord;

public interface NotificationSender {

  /** Returns normally only when the message was handed off; any failure is thrown. */
  void send(CardRecord card, SenderRecord sender);
}
