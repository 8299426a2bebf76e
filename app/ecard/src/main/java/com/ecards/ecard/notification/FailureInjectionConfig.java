/*
 * Where: eCard notification
 * What: Puts the failure-injecting wrapper in front of whichever sender is active
 */
package com.ecards.ecard.notification;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "ecard.delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectionConfig {

  /** Wraps the SMTP sender when mail is enabled, the logging sender otherwise. */
  @Bean
  @Primary
  public FailureInjectingNotificationSender failureInjectingNotificationSender(
      ObjectProvider<MailNotificationSender> mailSender,
      ObjectProvider<LoggingNotificationSender> loggingSender,
      @Value("${ecard.delivery.failure-injection.recipient-email-prefix:}")
          String recipientEmailPrefix) {
    NotificationSender delegate = mailSender.getIfAvailable();
    if (delegate == null) {
      delegate = loggingSender.getObject();
    }
    return new FailureInjectingNotificationSender(delegate, recipientEmailPrefix);
  }
}
