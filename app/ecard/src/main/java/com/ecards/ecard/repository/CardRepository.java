/*
 * Where: eCard data access
 * What: Inserts, reads and updates rows of the cards table
 * Why: Both workers and the request path share one set of card queries
 */
package com.ecards.ecard.repository;

import static com.ecards.common.JdbcTimestampUtils.toInstant;
import static com.ecards.common.JdbcTimestampUtils.toTimestamp;

import com.ecards.ecard.model.CardRecord;
import com.ecards.ecard.model.CardWithSender;
import com.ecards.ecard.model.SenderRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CardRepository {

  private static final String CARD_COLUMNS =
      """
      c.card_id, c.sender_id, c.recipient_name, c.recipient_email, c.message,
      c.custom_art_path, c.premade_art_id, c.scheduled_send_date, c.is_sent, c.sent_date,
      c.created_date, c.first_viewed_date, c.view_count, c.expiry_date
      """;

  private static final String SENDER_COLUMNS =
      """
      s.sender_id AS s_sender_id, s.name AS s_name, s.email AS s_email,
      s.created_date AS s_created_date
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(CardRecord card) {
    final String sql =
        """
        INSERT INTO cards (
          card_id,
          sender_id,
          recipient_name,
          recipient_email,
          message,
          custom_art_path,
          premade_art_id,
          scheduled_send_date,
          is_sent,
          sent_date,
          created_date,
          first_viewed_date,
          view_count,
          expiry_date
        ) VALUES (
          :cardId,
          :senderId,
          :recipientName,
          :recipientEmail,
          :message,
          :customArtPath,
          :premadeArtId,
          :scheduledSendDate,
          :sent,
          :sentDate,
          :createdDate,
          :firstViewedDate,
          :viewCount,
          :expiryDate
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cardId", card.cardId())
            .addValue("senderId", card.senderId())
            .addValue("recipientName", card.recipientName())
            .addValue("recipientEmail", card.recipientEmail())
            .addValue("message", card.message())
            .addValue("customArtPath", card.customArtPath())
            .addValue("premadeArtId", card.premadeArtId())
            .addValue("scheduledSendDate", toTimestamp(card.scheduledSendDate()))
            .addValue("sent", card.sent())
            .addValue("sentDate", toTimestamp(card.sentDate()))
            .addValue("createdDate", toTimestamp(card.createdDate()))
            .addValue("firstViewedDate", toTimestamp(card.firstViewedDate()))
            .addValue("viewCount", card.viewCount())
            .addValue("expiryDate", toTimestamp(card.expiryDate()));
    jdbcTemplate.update(sql, params);
    return card.cardId();
  }

  public Optional<CardRecord> findById(UUID cardId) {
    final String sql = "SELECT " + CARD_COLUMNS + " FROM cards c WHERE c.card_id = :cardId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cardId", cardId);
    return jdbcTemplate.query(sql, params, this::mapCard).stream().findFirst();
  }

  /** Row lock held until the surrounding transaction ends; concurrent viewers queue behind it. */
  public Optional<CardRecord> findByIdForUpdate(UUID cardId) {
    final String sql =
        "SELECT " + CARD_COLUMNS + " FROM cards c WHERE c.card_id = :cardId FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cardId", cardId);
    return jdbcTemplate.query(sql, params, this::mapCard).stream().findFirst();
  }

  public Optional<CardWithSender> findWithSenderById(UUID cardId) {
    final String sql =
        "SELECT "
            + CARD_COLUMNS
            + ", "
            + SENDER_COLUMNS
            + """
            FROM cards c
            JOIN senders s ON s.sender_id = c.sender_id
            WHERE c.card_id = :cardId
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cardId", cardId);
    return jdbcTemplate.query(sql, params, this::mapCardWithSender).stream().findFirst();
  }

  public List<CardRecord> findBySenderId(UUID senderId) {
    final String sql =
        "SELECT "
            + CARD_COLUMNS
            + """
            FROM cards c
            WHERE c.sender_id = :senderId
            ORDER BY c.created_date DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("senderId", senderId);
    return jdbcTemplate.query(sql, params, this::mapCard);
  }

  public List<CardWithSender> findRecentWithSender(int take) {
    final String sql =
        "SELECT "
            + CARD_COLUMNS
            + ", "
            + SENDER_COLUMNS
            + """
            FROM cards c
            JOIN senders s ON s.sender_id = c.sender_id
            ORDER BY c.created_date DESC
            LIMIT :take
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("take", take);
    return jdbcTemplate.query(sql, params, this::mapCardWithSender);
  }

  public List<CardRecord> findExpired(Instant now) {
    final String sql =
        "SELECT "
            + CARD_COLUMNS
            + """
            FROM cards c
            WHERE c.expiry_date <= :now
            ORDER BY c.expiry_date
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapCard);
  }

  public List<CardWithSender> findDueForDelivery(Instant now) {
    final String sql =
        "SELECT "
            + CARD_COLUMNS
            + ", "
            + SENDER_COLUMNS
            + """
            FROM cards c
            JOIN senders s ON s.sender_id = c.sender_id
            WHERE c.is_sent = FALSE
              AND c.scheduled_send_date IS NOT NULL
              AND c.scheduled_send_date <= :now
            ORDER BY c.scheduled_send_date
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapCardWithSender);
  }

  public int countDueForDelivery(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM cards
        WHERE is_sent = FALSE
          AND scheduled_send_date IS NOT NULL
          AND scheduled_send_date <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int updateViewState(
      UUID cardId, int viewCount, Instant firstViewedDate, Instant expiryDate) {
    final String sql =
        """
        UPDATE cards
        SET view_count = :viewCount,
            first_viewed_date = :firstViewedDate,
            expiry_date = :expiryDate
        WHERE card_id = :cardId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cardId", cardId)
            .addValue("viewCount", viewCount)
            .addValue("firstViewedDate", toTimestamp(firstViewedDate))
            .addValue("expiryDate", toTimestamp(expiryDate));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Marks every delivered card as sent in one batch. Rows already sent or removed since the pass
   * selected them are left alone.
   *
   * @return number of rows actually updated
   */
  public int markSentBatch(Map<UUID, Instant> sentDates) {
    if (sentDates.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE cards
        SET is_sent = TRUE,
            sent_date = :sentDate
        WHERE card_id = :cardId
          AND is_sent = FALSE
        """;
    final SqlParameterSource[] batch =
        sentDates.entrySet().stream()
            .map(
                entry ->
                    new MapSqlParameterSource()
                        .addValue("cardId", entry.getKey())
                        .addValue("sentDate", toTimestamp(entry.getValue())))
            .toArray(SqlParameterSource[]::new);
    return Arrays.stream(jdbcTemplate.batchUpdate(sql, batch)).map(n -> Math.max(n, 0)).sum();
  }

  // Manual resend refreshes sent_date even when the card was already delivered.
  public int markResent(UUID cardId, Instant sentDate) {
    final String sql =
        """
        UPDATE cards
        SET is_sent = TRUE,
            sent_date = :sentDate
        WHERE card_id = :cardId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cardId", cardId)
            .addValue("sentDate", toTimestamp(sentDate));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteByIds(Collection<UUID> cardIds) {
    if (cardIds.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM cards WHERE card_id IN (:cardIds)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cardIds", cardIds);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Deletes those of {@code cardIds} whose expiry is still at or before {@code now} and returns
   * their ids. A row locked by a concurrent view is re-checked after that view commits. View
   * records go with the card by cascade.
   */
  public List<UUID> deleteExpiredByIds(Collection<UUID> cardIds, Instant now) {
    if (cardIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        DELETE FROM cards
        WHERE card_id IN (:cardIds)
          AND expiry_date <= :now
        RETURNING card_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cardIds", cardIds)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getObject("card_id", UUID.class));
  }

  private CardRecord mapCard(ResultSet rs, int rowNum) throws SQLException {
    return new CardRecord(
        rs.getObject("card_id", UUID.class),
        rs.getObject("sender_id", UUID.class),
        rs.getString("recipient_name"),
        rs.getString("recipient_email"),
        rs.getString("message"),
        rs.getString("custom_art_path"),
        rs.getString("premade_art_id"),
        toInstant(rs.getTimestamp("scheduled_send_date")),
        rs.getBoolean("is_sent"),
        toInstant(rs.getTimestamp("sent_date")),
        toInstant(rs.getTimestamp("created_date")),
        toInstant(rs.getTimestamp("first_viewed_date")),
        rs.getInt("view_count"),
        toInstant(rs.getTimestamp("expiry_date")));
  }

  private CardWithSender mapCardWithSender(ResultSet rs, int rowNum) throws SQLException {
    final SenderRecord sender =
        new SenderRecord(
            rs.getObject("s_sender_id", UUID.class),
            rs.getString("s_name"),
            rs.getString("s_email"),
            toInstant(rs.getTimestamp("s_created_date")));
    return new CardWithSender(mapCard(rs, rowNum), sender);
  }
}
