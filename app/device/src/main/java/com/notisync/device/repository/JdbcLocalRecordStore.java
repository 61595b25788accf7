/*
 * Where: device data access
 * What: PostgreSQL implementation of the local record store
 * Why: records and queued operations must survive restarts and offline periods
 */
package com.notisync.device.repository;

import static com.notisync.common.JdbcTimestampUtils.toInstant;
import static com.notisync.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.model.NotificationCategory;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.SyncErrorEntry;
import com.notisync.device.model.SyncOperation;
import com.notisync.device.model.SyncOperationType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
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
import org.springframework.transaction.support.TransactionTemplate;

@Repository
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JDBC template and ObjectMapper are shared Spring beans")
public class JdbcLocalRecordStore implements LocalRecordStore {

  private static final TypeReference<Map<String, Object>> EXTRAS_TYPE = new TypeReference<>() {};

  private static final String RECORD_COLUMNS =
      """
      id, server_id, app_identity, title, body, category, priority, captured_at, source_id,
      extras::text AS extras_text, synced, sync_attempts, last_sync_attempt, is_read, is_dismissed,
      updated_at, server_updated_at
      """;

  private static final String OPERATION_COLUMNS =
      """
      id, type, notification_id, payload::text AS payload_text, attempts, created_at, last_attempt,
      last_error, abandoned_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final ObjectMapper objectMapper;

  @Override
  public void saveRecord(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          id, server_id, app_identity, title, body, category, priority, captured_at, source_id,
          extras, synced, sync_attempts, last_sync_attempt, is_read, is_dismissed, updated_at,
          server_updated_at
        ) VALUES (
          :id, :serverId, :appIdentity, :title, :body, :category, :priority, :capturedAt, :sourceId,
          :extras::jsonb, :synced, :syncAttempts, :lastSyncAttempt, :read, :dismissed, :updatedAt,
          :serverUpdatedAt
        )
        ON CONFLICT (id) DO UPDATE SET
          server_id = EXCLUDED.server_id,
          title = EXCLUDED.title,
          body = EXCLUDED.body,
          category = EXCLUDED.category,
          priority = EXCLUDED.priority,
          extras = EXCLUDED.extras,
          synced = EXCLUDED.synced,
          sync_attempts = EXCLUDED.sync_attempts,
          last_sync_attempt = EXCLUDED.last_sync_attempt,
          is_read = EXCLUDED.is_read,
          is_dismissed = EXCLUDED.is_dismissed,
          updated_at = EXCLUDED.updated_at,
          server_updated_at = EXCLUDED.server_updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("serverId", record.serverId())
            .addValue("appIdentity", record.appIdentity())
            .addValue("title", record.title())
            .addValue("body", record.body())
            .addValue("category", record.category().wireName())
            .addValue("priority", record.priority())
            .addValue("capturedAt", toTimestamp(record.timestamp()))
            .addValue("sourceId", record.sourceId())
            .addValue("extras", writeExtras(record.extras()))
            .addValue("synced", record.synced())
            .addValue("syncAttempts", record.syncAttempts())
            .addValue("lastSyncAttempt", toTimestamp(record.lastSyncAttempt()))
            .addValue("read", record.read())
            .addValue("dismissed", record.dismissed())
            .addValue("updatedAt", toTimestamp(record.updatedAt()))
            .addValue("serverUpdatedAt", toTimestamp(record.serverUpdatedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<NotificationRecord> getRecord(String id) {
    final String sql = "SELECT " + RECORD_COLUMNS + " FROM notifications WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("id", id), this::mapRecord)
        .stream()
        .findFirst();
  }

  @Override
  public Optional<NotificationRecord> findByServerId(String serverId) {
    final String sql =
        "SELECT " + RECORD_COLUMNS + " FROM notifications WHERE server_id = :serverId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("serverId", serverId), this::mapRecord)
        .stream()
        .findFirst();
  }

  @Override
  public List<NotificationRecord> listRecords(int limit, int offset) {
    final String sql =
        "SELECT "
            + RECORD_COLUMNS
            + " FROM notifications ORDER BY captured_at DESC, id LIMIT :limit OFFSET :offset";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRecord);
  }

  @Override
  public List<NotificationRecord> listUnsynced() {
    final String sql =
        "SELECT "
            + RECORD_COLUMNS
            + " FROM notifications WHERE synced = FALSE ORDER BY captured_at";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRecord);
  }

  @Override
  public void markSynced(String id, String serverId, Instant serverUpdatedAt) {
    final String sql =
        """
        UPDATE notifications
        SET server_id = :serverId,
            synced = TRUE,
            server_updated_at = :serverUpdatedAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("serverId", serverId)
            .addValue("serverUpdatedAt", toTimestamp(serverUpdatedAt));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public void incrementSyncAttempts(String id, Instant attemptedAt) {
    final String sql =
        """
        UPDATE notifications
        SET sync_attempts = sync_attempts + 1,
            last_sync_attempt = :attemptedAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("attemptedAt", toTimestamp(attemptedAt));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public void enqueueOperation(SyncOperation operation) {
    final String sql =
        """
        INSERT INTO sync_queue (
          id, type, notification_id, payload, attempts, created_at, last_attempt, last_error,
          abandoned_at
        ) VALUES (
          :id, :type, :notificationId, :payload::jsonb, :attempts, :createdAt, :lastAttempt,
          :lastError, :abandonedAt
        )
        ON CONFLICT (id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", operation.id())
            .addValue("type", operation.type().wireName())
            .addValue("notificationId", operation.notificationId())
            .addValue("payload", operation.payloadJson())
            .addValue("attempts", operation.attempts())
            .addValue("createdAt", toTimestamp(operation.createdAt()))
            .addValue("lastAttempt", toTimestamp(operation.lastAttempt()))
            .addValue("lastError", operation.lastError())
            .addValue("abandonedAt", toTimestamp(operation.abandonedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<SyncOperation> listOperations(int limit) {
    final String sql =
        "SELECT "
            + OPERATION_COLUMNS
            + " FROM sync_queue WHERE abandoned_at IS NULL ORDER BY created_at, id LIMIT :limit";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), this::mapOperation);
  }

  @Override
  public List<SyncOperation> listAbandonedOperations(int limit) {
    final String sql =
        "SELECT "
            + OPERATION_COLUMNS
            + " FROM sync_queue WHERE abandoned_at IS NOT NULL"
            + " ORDER BY abandoned_at DESC LIMIT :limit";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), this::mapOperation);
  }

  @Override
  public int countPendingOperations() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sync_queue WHERE abandoned_at IS NULL",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  @Override
  public void updateOperation(String id, int attempts, Instant lastAttempt, String error) {
    final String sql =
        """
        UPDATE sync_queue
        SET attempts = :attempts,
            last_attempt = :lastAttempt,
            last_error = :lastError
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("attempts", attempts)
            .addValue("lastAttempt", toTimestamp(lastAttempt))
            .addValue("lastError", error);
    jdbcTemplate.update(sql, params);
  }

  @Override
  public void markAbandoned(String id, Instant abandonedAt) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("abandonedAt", toTimestamp(abandonedAt));
    jdbcTemplate.update("UPDATE sync_queue SET abandoned_at = :abandonedAt WHERE id = :id", params);
  }

  @Override
  public void removeOperation(String id) {
    jdbcTemplate.update(
        "DELETE FROM sync_queue WHERE id = :id", new MapSqlParameterSource("id", id));
  }

  @Override
  public Optional<String> getSetting(String key) {
    return jdbcTemplate
        .queryForList(
            "SELECT value FROM app_settings WHERE key = :key",
            new MapSqlParameterSource("key", key),
            String.class)
        .stream()
        .findFirst();
  }

  @Override
  public void setSetting(String key, String value) {
    final String sql =
        """
        INSERT INTO app_settings (key, value, updated_at)
        VALUES (:key, :value, now())
        ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value, updated_at = EXCLUDED.updated_at
        """;
    jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("key", key).addValue("value", value));
  }

  @Override
  public void appendSyncError(SyncErrorEntry entry, int capacity) {
    final String insert =
        """
        INSERT INTO sync_error_log (
          operation_id, type, notification_id, attempts, error, occurred_at
        )
        VALUES (:operationId, :type, :notificationId, :attempts, :error, :occurredAt)
        """;
    // keep the newest `capacity` rows
    final String evict =
        """
        DELETE FROM sync_error_log
        WHERE id NOT IN (
          SELECT id FROM sync_error_log ORDER BY occurred_at DESC, id DESC LIMIT :capacity
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("operationId", entry.operationId())
            .addValue("type", entry.type().wireName())
            .addValue("notificationId", entry.notificationId())
            .addValue("attempts", entry.attempts())
            .addValue("error", entry.error())
            .addValue("occurredAt", toTimestamp(entry.occurredAt()));
    transactionTemplate.executeWithoutResult(
        status -> {
          jdbcTemplate.update(insert, params);
          jdbcTemplate.update(evict, new MapSqlParameterSource("capacity", capacity));
        });
  }

  @Override
  public List<SyncErrorEntry> listSyncErrors(int limit) {
    final String sql =
        """
        SELECT operation_id, type, notification_id, attempts, error, occurred_at
        FROM sync_error_log
        ORDER BY occurred_at DESC, id DESC
        LIMIT :limit
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("limit", limit),
        (rs, rowNum) ->
            new SyncErrorEntry(
                rs.getString("operation_id"),
                SyncOperationType.fromWireName(rs.getString("type")),
                rs.getString("notification_id"),
                rs.getInt("attempts"),
                rs.getString("error"),
                toInstant(rs.getTimestamp("occurred_at"))));
  }

  @Override
  public int deleteSyncedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE synced = TRUE
          AND captured_at < :threshold
          AND NOT EXISTS (SELECT 1 FROM sync_queue q WHERE q.notification_id = notifications.id)
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  private NotificationRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getString("id"),
        rs.getString("server_id"),
        rs.getString("app_identity"),
        rs.getString("title"),
        rs.getString("body"),
        NotificationCategory.fromWireName(rs.getString("category")),
        rs.getInt("priority"),
        toInstant(rs.getTimestamp("captured_at")),
        rs.getString("source_id"),
        readExtras(rs.getString("extras_text")),
        rs.getBoolean("synced"),
        rs.getInt("sync_attempts"),
        toInstant(rs.getTimestamp("last_sync_attempt")),
        rs.getBoolean("is_read"),
        rs.getBoolean("is_dismissed"),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("server_updated_at")));
  }

  private SyncOperation mapOperation(ResultSet rs, int rowNum) throws SQLException {
    return new SyncOperation(
        rs.getString("id"),
        SyncOperationType.fromWireName(rs.getString("type")),
        rs.getString("notification_id"),
        rs.getString("payload_text"),
        rs.getInt("attempts"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_attempt")),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("abandoned_at")));
  }

  private String writeExtras(Map<String, Object> extras) {
    try {
      return objectMapper.writeValueAsString(extras);
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
