/*
 * Where: Relay data access
 * What: Durable poller cursor with a lease held by one instance at a time
 * Why: A restart resumes after the last published id and two instances never interleave ids
 */
package com.mysocial.relay.repository;

import static com.mysocial.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OutboxCursorRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Takes or renews the lease on the named cursor.
   *
   * @return the committed cursor when the lease is held by {@code lockedBy}, empty when another
   *     instance owns an unexpired lease
   */
  public OptionalLong claimLease(String name, String lockedBy, Instant now, Instant leaseUntil) {
    final String sql =
        """
        INSERT INTO relay_outbox_cursor
          (name, last_processed_id, locked_by, lease_until, updated_at)
        VALUES (:name, 0, :lockedBy, :leaseUntil, :now)
        ON CONFLICT (name) DO UPDATE
        SET locked_by = EXCLUDED.locked_by,
            lease_until = EXCLUDED.lease_until,
            updated_at = EXCLUDED.updated_at
        WHERE relay_outbox_cursor.locked_by IS NULL
           OR relay_outbox_cursor.locked_by = EXCLUDED.locked_by
           OR relay_outbox_cursor.lease_until IS NULL
           OR relay_outbox_cursor.lease_until <= :now
        RETURNING last_processed_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("lockedBy", lockedBy)
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("now", toTimestamp(now));
    final List<Long> rows =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getLong("last_processed_id"));
    return rows.isEmpty() ? OptionalLong.empty() : OptionalLong.of(rows.get(0));
  }

  public int advance(String name, String lockedBy, long processedId, Instant now) {
    final String sql =
        """
        UPDATE relay_outbox_cursor
        SET last_processed_id = GREATEST(last_processed_id, :processedId),
            updated_at = :now
        WHERE name = :name
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("processedId", processedId)
            .addValue("now", toTimestamp(now))
            .addValue("name", name)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int releaseLease(String name, String lockedBy, Instant now) {
    final String sql =
        """
        UPDATE relay_outbox_cursor
        SET locked_by = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE name = :name
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("name", name)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }
}
