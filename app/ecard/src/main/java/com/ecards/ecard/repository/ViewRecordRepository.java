package com.ecards.ecard.repository;

import static com.ecards.common.JdbcTimestampUtils.toInstant;
import static com.ecards.common.JdbcTimestampUtils.toTimestamp;

import com.ecards.ecard.model.ViewRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ViewRecordRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(ViewRecord view) {
    final String sql =
        """
        INSERT INTO view_records (
          view_id,
          card_id,
          viewed_date,
          ip_address,
          user_agent
        ) VALUES (
          :viewId,
          :cardId,
          :viewedDate,
          :ipAddress,
          :userAgent
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("viewId", view.viewId())
            .addValue("cardId", view.cardId())
            .addValue("viewedDate", toTimestamp(view.viewedDate()))
            .addValue("ipAddress", view.ipAddress())
            .addValue("userAgent", view.userAgent());
    jdbcTemplate.update(sql, params);
  }

  public int deleteByCardIds(Collection<UUID> cardIds) {
    if (cardIds.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM view_records WHERE card_id IN (:cardIds)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cardIds", cardIds);
    return jdbcTemplate.update(sql, params);
  }

  public List<ViewRecord> findRecent(int take) {
    final String sql =
        """
        SELECT view_id, card_id, viewed_date, ip_address, user_agent
        FROM view_records
        ORDER BY viewed_date DESC
        LIMIT :take
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("take", take);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByCardId(UUID cardId) {
    final String sql = "SELECT COUNT(*) FROM view_records WHERE card_id = :cardId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cardId", cardId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private ViewRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ViewRecord(
        rs.getObject("view_id", UUID.class),
        rs.getObject("card_id", UUID.class),
        toInstant(rs.getTimestamp("viewed_date")),
        rs.getString("ip_address"),
        rs.getString("user_agent"));
  }
}
