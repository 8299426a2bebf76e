/*
 * Where: eCard notification
 * What: Sends the rendered notification over SMTP
 */
package com.ecards.ecard.notification;

import com.ecards.ecard.config.CardNotificationProperties;
import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.SenderRecord;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ecard.notification.mail-enabled", havingValue = "true")
public class MailNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(MailNotificationSender.class);

  private final JavaMailSender mailSender;
  private final NotificationTemplateRenderer renderer;
  private final CardNotificationProperties properties;

  @Override
  public void send(CardRecord card, SenderRecord sender) {
    final RenderedNotification rendered = renderer.render(card, sender);
    final MimeMessage message = mailSender.createMimeMessage();
    try {
      final MimeMessageHelper helper =
          new MimeMessageHelper(message, rendered.hasTextBody(), StandardCharsets.UTF_8.name());
      helper.setFrom(properties.fromEmail(), properties.resolvedFromName());
      helper.setTo(card.recipientEmail());
      helper.setSubject(rendered.subject());
      if (rendered.hasTextBody()) {
        helper.setText(rendered.textBody(), rendered.htmlBody());
      } else {
        helper.setText(rendered.htmlBody(), true);
      }
    } catch (MessagingException | UnsupportedEncodingException ex) {
      throw new MailPreparationException("failed to build ecard mail cardId=" + card.cardId(), ex);
    }
    // MailException propagates so the caller leaves the card unsent
    mailSender.send(message);
    logger.info("ecard mail sent cardId={} recipient={}", card.cardId(), card.recipientEmail());
  }
}
