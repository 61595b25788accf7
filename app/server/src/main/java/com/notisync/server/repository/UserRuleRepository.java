package com.notisync.server.repository;

import static com.notisync.common.JdbcTimestampUtils.toInstant;
import static com.notisync.common.JdbcTimestampUtils.toTimestamp;

import com.notisync.common.rules.InvalidRuleException;
import com.notisync.common.rules.Rule;
import com.notisync.common.rules.RuleCodec;
import com.notisync.common.rules.RuleDocument;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Per-user rule sets; rule ids are unique within a user only. */
@Repository
@RequiredArgsConstructor
public class UserRuleRepository {

  private static final Logger logger = LoggerFactory.getLogger(UserRuleRepository.class);

  private static final String COLUMNS =
      """
      id, name, type, priority, enabled, conditions::text AS conditions_text,
      actions::text AS actions_text, schema_version, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final RuleCodec ruleCodec;

  public List<Rule> findByUser(String userId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM user_rules WHERE user_id = :userId ORDER BY priority DESC, created_at, id";
    final List<Rule> rules = new ArrayList<>();
    for (RuleDocument document :
        jdbcTemplate.query(sql, new MapSqlParameterSource("userId", userId), this::mapRow)) {
      try {
        rules.add(ruleCodec.decode(document));
      } catch (InvalidRuleException ex) {
        logger.warn(
            "stored rule skipped userId={} ruleId={} reason={}",
            userId,
            document.id(),
            ex.getMessage());
      }
    }
    return rules;
  }

  public Optional<Rule> findById(String userId, String id) {
    final String sql =
        "SELECT " + COLUMNS + " FROM user_rules WHERE user_id = :userId AND id = :id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream()
        .findFirst()
        .map(ruleCodec::decode);
  }

  public int countByUser(String userId) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM user_rules WHERE user_id = :userId",
            new MapSqlParameterSource("userId", userId),
            Integer.class);
    return count == null ? 0 : count;
  }

  public void save(String userId, Rule rule) {
    final RuleDocument document = ruleCodec.encode(rule);
    final String sql =
        """
        INSERT INTO user_rules (
          user_id, id, name, type, priority, enabled, conditions, actions, schema_version,
          created_at, updated_at
        ) VALUES (
          :userId, :id, :name, :type, :priority, :enabled, :conditions::jsonb, :actions::jsonb,
          :schemaVersion, :createdAt, :updatedAt
        )
        ON CONFLICT (user_id, id) DO UPDATE SET
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
            .addValue("userId", userId)
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

  public boolean delete(String userId, String id) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("id", id);
    return jdbcTemplate.update(
            "DELETE FROM user_rules WHERE user_id = :userId AND id = :id", params)
        > 0;
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
