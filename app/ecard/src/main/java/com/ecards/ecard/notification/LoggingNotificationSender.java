/*
 * Where: eCard notification
 * What: Renders the notification and writes it to the log instead of mailing it
 * Why: Local runs and tests exercise the full delivery path without an SMTP server
 */
package com.ecards.ecard.notification;

import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.SenderRecord;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "ecard.notification.mail-enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LoggingNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationSender.class);

  private final NotificationTemplateRenderer renderer;

  @Override
  public void send(CardRecord card, SenderRecord sender) {
    final RenderedNotification rendered = renderer.render(card, sender);
    logger.info(
        "ecard notification simulated send cardId={} recipient={} subject={}",
        card.cardId(),
        card.recipientEmail(),
        rendered.subject());
  }
}
