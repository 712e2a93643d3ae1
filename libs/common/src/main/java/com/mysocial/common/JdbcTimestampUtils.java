/*
 * Where: Shared JDBC helpers
 * What: Converts Instant values into Timestamp parameters
 * Why: The PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.mysocial.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; the relay never binds zone-dependent temporal types.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
