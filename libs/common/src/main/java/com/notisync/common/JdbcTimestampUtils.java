/*
 * Where: shared JDBC helpers
 * What: converts between Instant and java.sql.Timestamp for NamedParameterJdbcTemplate binds
 * Why: the PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.notisync.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
