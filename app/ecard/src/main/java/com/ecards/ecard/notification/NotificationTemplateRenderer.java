/*
 * Where: eCard notification
 * What: Renders subject, HTML and plain-text bodies from classpath templates
 * Why: Mail wording is edited without touching code
 */
package com.ecards.ecard.notification;

import com.ecards.ecard.config.CardNotificationProperties;
import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.SenderRecord;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

/**
 * Looks up {@code templates/mail/{name}.subject.txt}, {@code {name}.html} and the optional {@code
 * {name}.txt} and substitutes {@code {{Placeholder}}} variables. Values are HTML-escaped in the
 * HTML body only. Unknown placeholders are left as written. Substituted values are never scanned
 * for placeholders again.
 */
@Component
@RequiredArgsConstructor
public class NotificationTemplateRenderer {

  static final String TEMPLATE_LOCATION = "classpath:templates/mail/";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)\\}\\}");

  private final ResourceLoader resourceLoader;
  private final CardNotificationProperties properties;

  public RenderedNotification render(CardRecord card, SenderRecord sender) {
    return render(properties.templateName(), variables(card, sender));
  }

  @VisibleForTesting
  RenderedNotification render(String templateName, Map<String, String> variables) {
    final String subjectTemplate =
        load(templateName + ".subject.txt")
            .orElseThrow(() -> missing(templateName, "subject"));
    final String htmlTemplate =
        load(templateName + ".html").orElseThrow(() -> missing(templateName, "html"));
    final Optional<String> textTemplate = load(templateName + ".txt");

    final Map<String, String> htmlVariables = new LinkedHashMap<>();
    variables.forEach((key, value) -> htmlVariables.put(key, HtmlUtils.htmlEscape(value)));

    final String subject = substitute(subjectTemplate, variables).strip();
    final String html = substitute(htmlTemplate, htmlVariables);
    final String text = textTemplate.map(template -> substitute(template, variables)).orElse(null);
    return new RenderedNotification(subject, html, text);
  }

  @VisibleForTesting
  Map<String, String> variables(CardRecord card, SenderRecord sender) {
    final Map<String, String> variables = new LinkedHashMap<>();
    variables.put("RecipientName", nullToEmpty(card.recipientName()));
    variables.put("SenderName", nullToEmpty(sender.name()));
    variables.put("SenderEmail", nullToEmpty(sender.email()));
    variables.put("CardMessage", nullToEmpty(card.message()));
    variables.put("ViewUrl", properties.viewUrl(card.cardId()));
    variables.put("AppName", properties.appName());
    return variables;
  }

  private String substitute(String template, Map<String, String> variables) {
    final Matcher matcher = PLACEHOLDER.matcher(template);
    final StringBuilder out = new StringBuilder(template.length());
    while (matcher.find()) {
      final String value = variables.get(matcher.group(1));
      matcher.appendReplacement(
          out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private Optional<String> load(String fileName) {
    final Resource resource = resourceLoader.getResource(TEMPLATE_LOCATION + fileName);
    if (!resource.exists()) {
      return Optional.empty();
    }
    try (InputStream in = resource.getInputStream()) {
      return Optional.of(StreamUtils.copyToString(in, StandardCharsets.UTF_8));
    } catch (IOException ex) {
      throw new NotificationTemplateException("failed to read mail template " + fileName, ex);
    }
  }

  private NotificationTemplateException missing(String templateName, String part) {
    return new NotificationTemplateException(
        "mail template not found name=" + templateName + " part=" + part);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
