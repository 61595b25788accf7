/*
 * Where: device data access
 * What: stores the device's rule set and per-rule trigger counters
 * Why: rules are edited locally and must apply offline
 */
package com.notisync.device.repository;

import static com.notisync.common.JdbcTimestampUtils.toInstant;
import static com.notisync.common.JdbcTimestampUtils.toTimestamp;

import com.notisync.common.rules.InvalidRuleException;
import com.notisync.common.rules.Rule;
import com.notisync.common.rules.RuleCodec;
import com.notisync.common.rules.RuleDocument;
import com.notisync.device.model.RuleTriggerStats;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeviceRuleRepository {

  private static final Logger logger = LoggerFactory.getLogger(DeviceRuleRepository.class);

  private static final String COLUMNS =
      """
      id, name, type, priority, enabled, conditions::text AS conditions_text,
      actions::text AS actions_text, schema_version, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final RuleCodec ruleCodec;

  /** Rows that no longer decode are skipped so one bad rule cannot stall the pipeline. */
  public List<Rule> findAll() {
    final String sql = "SELECT " + COLUMNS + " FROM rules ORDER BY priority DESC, created_at, id";
    final List<Rule> rules = new ArrayList<>();
    for (RuleDocument document :
        jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow)) {
      try {
        rules.add(ruleCodec.decode(document));
      } catch (InvalidRuleException ex) {
        logger.warn("stored rule skipped ruleId={} reason={}", document.id(), ex.getMessage());
      }
    }
    return rules;
  }

  public Optional<Rule> findById(String id) {
    final String sql = "SELECT " + COLUMNS + " FROM rules WHERE id = :id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("id", id), this::mapRow).stream()
        .findFirst()
        .map(ruleCodec::decode);
  }

  public int count() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM rules", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public void save(Rule rule) {
    final RuleDocument document = ruleCodec.encode(rule);
    final String sql =
        """
        INSERT INTO rules (
          id, name, type, priority, enabled, conditions, actions, schema_version,
          created_at, updated_at
        ) VALUES (
          :id, :name, :type, :priority, :enabled, :conditions::jsonb, :actions::jsonb,
          :schemaVersion, :createdAt, :updatedAt
        )
        ON CONFLICT (id) DO UPDATE SET
          name = EXCLUDED.name,
          priority = EXCLUDED.priority,
          enabled = EXCLUDED.enabled,
          conditions = EXCLUDED.conditions,
          actions = EXCLUDED.actions,
          schema_version = EXCLUDED.schema_version,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", document.id())
            .addValue("name", document.name())
            .addValue("type", document.type())
            .addValue("priority", document.priority())
            .addValue("enabled", document.enabled())
            .addValue("conditions", ruleCodec.toJson(document.conditions()))
            .addValue("actions", ruleCodec.toJson(document.actions()))
            .addValue("schemaVersion", document.schemaVersion())
            .addValue("createdAt", toTimestamp(document.createdAt()))
            .addValue("updatedAt", toTimestamp(document.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public boolean delete(String id) {
    return jdbcTemplate.update(
            "DELETE FROM rules WHERE id = :id", new MapSqlParameterSource("id", id))
        > 0;
  }

  public void recordTriggers(List<String> ruleIds, Instant triggeredAt) {
    if (ruleIds.isEmpty()) {
      return;
    }
    final String sql =
        """
        UPDATE rules
        SET trigger_count = trigger_count + 1,
            last_triggered = :triggeredAt
        WHERE id IN (:ids)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ids", ruleIds)
            .addValue("triggeredAt", toTimestamp(triggeredAt));
    jdbcTemplate.update(sql, params);
  }

  public List<RuleTriggerStats> findTriggerStats() {
    final String sql =
        "SELECT id, trigger_count, last_triggered FROM rules ORDER BY trigger_count DESC, id";
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new RuleTriggerStats(
                rs.getString("id"),
                rs.getLong("trigger_count"),
                toInstant(rs.getTimestamp("last_triggered"))));
  }

  private RuleDocument mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RuleDocument(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("type"),
        rs.getInt("priority"),
        rs.getBoolean("enabled"),
        ruleCodec.fromJson(rs.getString("conditions_text")),
        ruleCodec.fromJson(rs.getString("actions_text")),
        rs.getInt("schema_version"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
