package com.ecards.ecard.repository;

import com.ecards.ecard.model.PremadeTemplateRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PremadeTemplateRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<PremadeTemplateRecord> findActive() {
    final String sql =
        """
        SELECT template_id, name, category, icon_emoji, description, image_path,
               is_active, sort_order
        FROM premade_templates
        WHERE is_active = TRUE
        ORDER BY sort_order, template_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<PremadeTemplateRecord> findActiveById(String templateId) {
    final String sql =
        """
        SELECT template_id, name, category, icon_emoji, description, image_path,
               is_active, sort_order
        FROM premade_templates
        WHERE template_id = :templateId
          AND is_active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("templateId", templateId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void insert(PremadeTemplateRecord template) {
    final String sql =
        """
        INSERT INTO premade_templates (
          template_id,
          name,
          category,
          icon_emoji,
          description,
          image_path,
          is_active,
          sort_order
        ) VALUES (
          :templateId,
          :name,
          :category,
          :iconEmoji,
          :description,
          :imagePath,
          :active,
          :sortOrder
        )
        """;
    jdbcTemplate.update(sql, params(template));
  }

  public int update(PremadeTemplateRecord template) {
    final String sql =
        """
        UPDATE premade_templates
        SET name = :name,
            category = :category,
            icon_emoji = :iconEmoji,
            description = :description,
            image_path = :imagePath,
            is_active = :active,
            sort_order = :sortOrder
        WHERE template_id = :templateId
        """;
    return jdbcTemplate.update(sql, params(template));
  }

  public int deactivate(String templateId) {
    final String sql =
        """
        UPDATE premade_templates
        SET is_active = FALSE
        WHERE template_id = :templateId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("templateId", templateId);
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource params(PremadeTemplateRecord template) {
    return new MapSqlParameterSource()
        .addValue("templateId", template.templateId())
        .addValue("name", template.name())
        .addValue("category", template.category())
        .addValue("iconEmoji", template.iconEmoji())
        .addValue("description", template.description())
        .addValue("imagePath", template.imagePath())
        .addValue("active", template.active())
        .addValue("sortOrder", template.sortOrder());
  }

  private PremadeTemplateRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PremadeTemplateRecord(
        rs.getString("template_id"),
        rs.getString("name"),
        rs.getString("category"),
        rs.getString("icon_emoji"),
        rs.getString("description"),
        rs.getString("image_path"),
        rs.getBoolean("is_active"),
        rs.getInt("sort_order"));
  }
}
