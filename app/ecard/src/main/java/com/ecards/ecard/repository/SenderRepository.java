package com.ecards.ecard.repository;

import static com.ecards.common.JdbcTimestampUtils.toInstant;
import static com.ecards.common.JdbcTimestampUtils.toTimestamp;

import com.ecards.ecard.model.SenderRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SenderRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts the sender unless one with the same email exists.
   *
   * @return true when a new row was written
   */
  public boolean insertIfAbsent(SenderRecord sender) {
    final String sql =
        """
        INSERT INTO senders (
          sender_id,
          name,
          email,
          created_date
        ) VALUES (
          :senderId,
          :name,
          :email,
          :createdDate
        )
        ON CONFLICT (email) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("senderId", sender.senderId())
            .addValue("name", sender.name())
            .addValue("email", sender.email())
            .addValue("createdDate", toTimestamp(sender.createdDate()));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public Optional<SenderRecord> findByEmail(String email) {
    final String sql =
        """
        SELECT sender_id, name, email, created_date
        FROM senders
        WHERE email = :email
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("email", email);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<SenderRecord> findById(UUID senderId) {
    final String sql =
        """
        SELECT sender_id, name, email, created_date
        FROM senders
        WHERE sender_id = :senderId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("senderId", senderId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private SenderRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SenderRecord(
        rs.getObject("sender_id", UUID.class),
        rs.getString("name"),
        rs.getString("email"),
        toInstant(rs.getTimestamp("created_date")));
  }
}
