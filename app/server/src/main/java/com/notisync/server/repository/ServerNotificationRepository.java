/*
 * Where: server data access
 * What: reads and writes the server copy of each user's notifications
 * Why: (user_id, client_id) uniqueness is what makes create calls idempotent across retries
 */
package com.notisync.server.repository;

import static com.notisync.common.JdbcTimestampUtils.toInstant;
import static com.notisync.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.api.ServerNotification;
import com.notisync.common.model.NotificationCategory;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ServerNotificationRepository {

  private static final TypeReference<Map<String, Object>> EXTRAS_TYPE = new TypeReference<>() {};

  private static final String COLUMNS =
      """
      id, client_id, source_device_id, app_name, package_name, title, body, category, priority,
      notified_at, extras::text AS extras_text, is_read, is_dismissed, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  /** Empty when a row with the same client id already exists for the user. */
  public Optional<ServerNotification> insertIfAbsent(
      String userId, ServerNotification notification, Instant createdAt) {
    final String sql =
        """
        INSERT INTO notifications (
          id, user_id, client_id, source_device_id, app_name, package_name, title, body,
          category, priority, notified_at, extras, is_read, is_dismissed, created_at, updated_at
        ) VALUES (
          :id, :userId, :clientId, :sourceDeviceId, :appName, :packageName, :title, :body,
          :category, :priority, :notifiedAt, :extras::jsonb, :isRead, :isDismissed,
          :createdAt, :updatedAt
        )
        ON CONFLICT (user_id, client_id) DO NOTHING
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", notification.id())
            .addValue("userId", userId)
            .addValue("clientId", notification.clientId())
            .addValue("sourceDeviceId", notification.sourceDeviceId())
            .addValue("appName", notification.appName())
            .addValue("packageName", notification.packageName())
            .addValue("title", notification.title())
            .addValue("body", notification.body())
            .addValue("category", notification.category().wireName())
            .addValue("priority", notification.priority())
            .addValue("notifiedAt", toTimestamp(notification.timestamp()))
            .addValue("extras", writeExtras(notification.extras()))
            .addValue("isRead", notification.isRead())
            .addValue("isDismissed", notification.isDismissed())
            .addValue("createdAt", toTimestamp(createdAt))
            .addValue("updatedAt", toTimestamp(notification.updatedAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ServerNotification> findById(String userId, String id) {
    final String sql =
        "SELECT " + COLUMNS + " FROM notifications WHERE user_id = :userId AND id = :id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ServerNotification> findByClientId(String userId, String clientId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM notifications WHERE user_id = :userId AND client_id = :clientId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("clientId", clientId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Newest first. */
  public List<ServerNotification> findByUser(String userId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM notifications WHERE user_id = :userId"
            + " ORDER BY notified_at DESC, id LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<ServerNotification> updateFlags(
      String userId, String id, boolean read, boolean dismissed, Instant updatedAt) {
    final String sql =
        """
        UPDATE notifications
        SET is_read = :isRead,
            is_dismissed = :isDismissed,
            updated_at = :updatedAt
        WHERE user_id = :userId AND id = :id
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("id", id)
            .addValue("isRead", read)
            .addValue("isDismissed", dismissed)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private ServerNotification mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ServerNotification(
        rs.getString("id"),
        rs.getString("client_id"),
        rs.getString("source_device_id"),
        rs.getString("app_name"),
        rs.getString("package_name"),
        rs.getString("title"),
        rs.getString("body"),
        NotificationCategory.fromWireName(rs.getString("category")),
        rs.getInt("priority"),
        toInstant(rs.getTimestamp("notified_at")),
        readExtras(rs.getString("extras_text")),
        rs.getBoolean("is_read"),
        rs.getBoolean("is_dismissed"),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private String writeExtras(Map<String, Object> extras) {
    try {
      return objectMapper.writeValueAsString(extras == null ? Map.of() : extras);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("extras are not serializable", ex);
    }
  }

  private Map<String, Object> readExtras(String json) {
    if (json == null) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, EXTRAS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored extras are unreadable", ex);
    }
  }
}
