package com.ecards.ecard.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ecards.ecard.TestCards;
import com.ecards.ecard.config.CardNotificationProperties;
import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.SenderRecord;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class NotificationTemplateRendererTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  private final NotificationTemplateRenderer renderer =
      new NotificationTemplateRenderer(new DefaultResourceLoader(), properties("ecard-notification"));

  @Test
  void rendersAllThreePartsWithCardValues() {
    final SenderRecord sender = TestCards.sender("alice@example.com", NOW);
    final CardRecord card = TestCards.unsentCard(sender.senderId(), NOW, NOW, NOW);

    final RenderedNotification rendered = renderer.render(card, sender);

    assertThat(rendered.subject()).isEqualTo("Alice sent you an eCard");
    assertThat(rendered.htmlBody())
        .contains("Hi Bob,")
        .contains("Happy Birthday!")
        .contains("https://cards.example.test/view/" + card.cardId());
    assertThat(rendered.hasTextBody()).isTrue();
    assertThat(rendered.textBody()).contains("Open your card: https://cards.example.test/view/");
  }

  @Test
  void htmlBodyEscapesValuesButTextBodyDoesNot() {
    final SenderRecord sender =
        new SenderRecord(UUID.randomUUID(), "Tom & <Jerry>", "tom@example.com", NOW);
    final CardRecord card = TestCards.unsentCard(sender.senderId(), NOW, NOW, NOW);

    final RenderedNotification rendered = renderer.render(card, sender);

    assertThat(rendered.htmlBody()).contains("Tom &amp; &lt;Jerry&gt;").doesNotContain("<Jerry>");
    assertThat(rendered.textBody()).contains("Tom & <Jerry>");
    assertThat(rendered.subject()).isEqualTo("Tom & <Jerry> sent you an eCard");
  }

  @Test
  void placeholdersInsideCardValuesAreKeptLiterally() {
    final SenderRecord sender =
        new SenderRecord(UUID.randomUUID(), "{{RecipientName}}", "alice@example.com", NOW);
    final CardRecord card =
        TestCards.withMessage(
            TestCards.unsentCard(sender.senderId(), NOW, NOW, NOW),
            "mail me at {{SenderEmail}}, literal {{CardMessage}} and $1 \\o/");

    final RenderedNotification rendered = renderer.render(card, sender);

    assertThat(rendered.textBody())
        .contains("mail me at {{SenderEmail}}, literal {{CardMessage}} and $1 \\o/")
        .contains("{{RecipientName}} (alice@example.com)");
    assertThat(rendered.htmlBody()).contains("mail me at {{SenderEmail}}");
    assertThat(rendered.subject()).isEqualTo("{{RecipientName}} sent you an eCard");
  }

  @Test
  void unknownPlaceholdersAreLeftAsWritten() {
    final RenderedNotification rendered =
        renderer.render("ecard-notification", Map.of("SenderName", "Alice"));

    assertThat(rendered.subject()).isEqualTo("Alice sent you an eCard");
    assertThat(rendered.textBody()).contains("{{CardMessage}}").contains("{{ViewUrl}}");
  }

  @Test
  void missingTemplateFailsWithNameAndPart() {
    assertThatThrownBy(() -> renderer.render("does-not-exist", Map.of()))
        .isInstanceOf(NotificationTemplateException.class)
        .hasMessageContaining("does-not-exist")
        .hasMessageContaining("subject");
  }

  @Test
  void variablesUseTrimmedFrontendUrl() {
    final NotificationTemplateRenderer trailingSlash =
        new NotificationTemplateRenderer(
            new DefaultResourceLoader(),
            new CardNotificationProperties(
                "eCards",
                "https://cards.example.test/",
                "ecard-notification",
                false,
                "noreply@example.com",
                null));
    final SenderRecord sender = TestCards.sender("alice@example.com", NOW);
    final CardRecord card = TestCards.unsentCard(sender.senderId(), NOW, NOW, NOW);

    assertThat(trailingSlash.variables(card, sender))
        .containsEntry("ViewUrl", "https://cards.example.test/view/" + card.cardId())
        .containsEntry("AppName", "eCards")
        .containsEntry("SenderEmail", "alice@example.com");
  }

  static CardNotificationProperties properties(String templateName) {
    return new CardNotificationProperties(
        "eCards",
        "https://cards.example.test",
        templateName,
        false,
        "noreply@example.com",
        "eCards Team");
  }
}
