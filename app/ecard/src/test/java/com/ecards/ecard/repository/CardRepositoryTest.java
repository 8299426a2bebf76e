/*
 * Where: eCard repository integration test
 * What: Runs the card, sender, view and template queries against Postgres
 * Why: Expiry and due-date boundaries must hold in the real dialect
 */
package com.ecards.ecard.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ecards.ecard.AbstractPostgresContainerTest;
import com.ecards.ecard.TestCards;
import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.CardWithSender;
import com.ecards.ecard.model.PremadeTemplateRecord;
import com.ecards.ecard.model.SenderRecord;
import com.ecards.ecard.model.ViewRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CardRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2025-03-01T10:00:00Z");

  @Autowired private CardRepository cardRepository;
  @Autowired private SenderRepository senderRepository;
  @Autowired private ViewRecordRepository viewRecordRepository;
  @Autowired private PremadeTemplateRepository templateRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private SenderRecord sender;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM view_records", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM cards", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM senders", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM premade_templates", new MapSqlParameterSource());
    sender = TestCards.sender("alice@example.com", BASE_TIME);
    senderRepository.insertIfAbsent(sender);
  }

  @Test
  void insertAndReadBackWithSender() {
    final CardRecord card = card(BASE_TIME, BASE_TIME.plus(Duration.ofDays(14)));
    cardRepository.insert(card);

    assertThat(cardRepository.findById(card.cardId())).contains(card);
    final CardWithSender withSender = cardRepository.findWithSenderById(card.cardId()).orElseThrow();
    assertThat(withSender.card()).isEqualTo(card);
    assertThat(withSender.sender()).isEqualTo(sender);
    assertThat(cardRepository.findBySenderId(sender.senderId())).containsExactly(card);
  }

  @Test
  void senderEmailIsUnique() {
    final SenderRecord duplicate = TestCards.sender("alice@example.com", BASE_TIME.plusSeconds(60));

    assertThat(senderRepository.insertIfAbsent(duplicate)).isFalse();
    assertThat(senderRepository.findByEmail("alice@example.com")).contains(sender);
  }

  @Test
  void findExpiredIncludesTheBoundaryInstant() {
    final Instant now = BASE_TIME.plus(Duration.ofDays(14));
    final CardRecord past = card(BASE_TIME, now.minusSeconds(1));
    final CardRecord exact = card(BASE_TIME, now);
    final CardRecord future = card(BASE_TIME, now.plusSeconds(1));
    cardRepository.insert(past);
    cardRepository.insert(exact);
    cardRepository.insert(future);

    assertThat(cardRepository.findExpired(now))
        .extracting(CardRecord::cardId)
        .containsExactly(past.cardId(), exact.cardId());
  }

  @Test
  void dueForDeliveryExcludesFutureAndSentCards() {
    final Instant now = BASE_TIME.plus(Duration.ofDays(9));
    final CardRecord due = card(now.minusSeconds(60), BASE_TIME.plus(Duration.ofDays(30)));
    final CardRecord exact = card(now, BASE_TIME.plus(Duration.ofDays(30)));
    final CardRecord future = card(now.plusSeconds(60), BASE_TIME.plus(Duration.ofDays(30)));
    cardRepository.insert(due);
    cardRepository.insert(exact);
    cardRepository.insert(future);
    cardRepository.markResent(exact.cardId(), now);

    assertThat(cardRepository.findDueForDelivery(now))
        .extracting(item -> item.card().cardId())
        .containsExactly(due.cardId());
    assertThat(cardRepository.countDueForDelivery(now)).isEqualTo(1);
  }

  @Test
  void markSentBatchSkipsCardsAlreadySent() {
    final CardRecord first = card(BASE_TIME, BASE_TIME.plus(Duration.ofDays(14)));
    final CardRecord second = card(BASE_TIME, BASE_TIME.plus(Duration.ofDays(14)));
    cardRepository.insert(first);
    cardRepository.insert(second);
    final Instant earlier = BASE_TIME.plusSeconds(30);
    cardRepository.markResent(second.cardId(), earlier);

    final Map<UUID, Instant> sentDates = new LinkedHashMap<>();
    sentDates.put(first.cardId(), BASE_TIME.plusSeconds(60));
    sentDates.put(second.cardId(), BASE_TIME.plusSeconds(60));
    sentDates.put(UUID.randomUUID(), BASE_TIME.plusSeconds(60));

    assertThat(cardRepository.markSentBatch(sentDates)).isEqualTo(1);
    assertThat(cardRepository.findById(first.cardId()).orElseThrow().sentDate())
        .isEqualTo(BASE_TIME.plusSeconds(60));
    assertThat(cardRepository.findById(second.cardId()).orElseThrow().sentDate()).isEqualTo(earlier);
    assertThat(cardRepository.markSentBatch(Map.of())).isZero();
  }

  @Test
  void viewStateUpdateAndConstraint() {
    final CardRecord card = card(BASE_TIME, BASE_TIME.plus(Duration.ofDays(30)));
    cardRepository.insert(card);
    final Instant viewedAt = BASE_TIME.plus(Duration.ofDays(2));

    cardRepository.updateViewState(card.cardId(), 1, viewedAt, viewedAt.plus(Duration.ofDays(14)));

    final CardRecord stored = cardRepository.findById(card.cardId()).orElseThrow();
    assertThat(stored.viewCount()).isEqualTo(1);
    assertThat(stored.firstViewedDate()).isEqualTo(viewedAt);
    assertThat(stored.expiryDate()).isEqualTo(viewedAt.plus(Duration.ofDays(14)));
    assertThatThrownBy(
            () -> cardRepository.updateViewState(card.cardId(), 2, null, stored.expiryDate()))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void deletingCardsCascadesToViewRecords() {
    final CardRecord card = card(BASE_TIME, BASE_TIME.plus(Duration.ofDays(14)));
    cardRepository.insert(card);
    viewRecordRepository.insert(
        new ViewRecord(UUID.randomUUID(), card.cardId(), BASE_TIME, "203.0.113.7", "agent"));
    viewRecordRepository.insert(
        new ViewRecord(UUID.randomUUID(), card.cardId(), BASE_TIME.plusSeconds(5), null, null));

    assertThat(viewRecordRepository.countByCardId(card.cardId())).isEqualTo(2);
    assertThat(viewRecordRepository.findRecent(1))
        .singleElement()
        .extracting(ViewRecord::viewedDate)
        .isEqualTo(BASE_TIME.plusSeconds(5));

    assertThat(cardRepository.deleteByIds(List.of(card.cardId()))).isEqualTo(1);
    assertThat(viewRecordRepository.countByCardId(card.cardId())).isZero();
    assertThat(cardRepository.deleteByIds(List.of())).isZero();
  }

  @Test
  void expiredDeleteKeepsCardsWhoseExpiryMovedAfterSelection() {
    final Instant now = BASE_TIME.plus(Duration.ofDays(20));
    final CardRecord viewedMeanwhile = card(BASE_TIME, BASE_TIME.plus(Duration.ofDays(14)));
    final CardRecord stillExpired = card(BASE_TIME, BASE_TIME.plus(Duration.ofDays(14)));
    cardRepository.insert(viewedMeanwhile);
    cardRepository.insert(stillExpired);
    viewRecordRepository.insert(
        new ViewRecord(UUID.randomUUID(), viewedMeanwhile.cardId(), now, null, null));
    final List<UUID> selected =
        cardRepository.findExpired(now).stream().map(CardRecord::cardId).toList();
    assertThat(selected)
        .containsExactlyInAnyOrder(viewedMeanwhile.cardId(), stillExpired.cardId());

    cardRepository.updateViewState(
        viewedMeanwhile.cardId(), 1, now, now.plus(Duration.ofDays(14)));

    assertThat(cardRepository.deleteExpiredByIds(selected, now))
        .containsExactly(stillExpired.cardId());
    assertThat(cardRepository.findById(viewedMeanwhile.cardId())).isPresent();
    assertThat(cardRepository.findById(stillExpired.cardId())).isEmpty();
    assertThat(viewRecordRepository.countByCardId(viewedMeanwhile.cardId())).isEqualTo(1);
    assertThat(cardRepository.deleteExpiredByIds(List.of(), now)).isEmpty();
  }

  @Test
  void templatesAreOrderedAndDeactivated() {
    templateRepository.insert(template("hearts", 2));
    templateRepository.insert(template("balloons", 1));
    templateRepository.insert(template("cake", 1));

    assertThat(templateRepository.findActive())
        .extracting(PremadeTemplateRecord::templateId)
        .containsExactly("balloons", "cake", "hearts");

    assertThat(templateRepository.deactivate("cake")).isEqualTo(1);
    assertThat(templateRepository.deactivate("cake")).isEqualTo(1);
    assertThat(templateRepository.deactivate("missing")).isZero();
    assertThat(templateRepository.findActiveById("cake")).isEmpty();
    assertThatThrownBy(() -> templateRepository.insert(template("hearts", 3)))
        .isInstanceOf(DuplicateKeyException.class);
  }

  private CardRecord card(Instant scheduled, Instant expiry) {
    return TestCards.unsentCard(sender.senderId(), scheduled, BASE_TIME, expiry);
  }

  private static PremadeTemplateRecord template(String templateId, int sortOrder) {
    return new PremadeTemplateRecord(
        templateId, templateId, "birthday", "B", null, null, true, sortOrder);
  }
}
