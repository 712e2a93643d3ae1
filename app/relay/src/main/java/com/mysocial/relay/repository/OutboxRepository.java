/*
 * Where: Relay data access
 * What: Reads unprocessed relay_outbox rows and stamps publish results
 * Why: The indexer owns the rows; the relay only reads and flips processing columns
 */
package com.mysocial.relay.repository;

import static com.mysocial.common.JdbcTimestampUtils.toInstant;
import static com.mysocial.common.JdbcTimestampUtils.toTimestamp;

import com.mysocial.relay.model.OutboxRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OutboxRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OutboxRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // EI_EXPOSE_REP2: wrap the shared JdbcTemplate instead of keeping the caller's reference
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public List<OutboxRecord> findUnprocessedAfter(long cursor, int maxAttempts, int limit) {
    // rows still waiting for their retry time are returned too so the caller can keep id order
    final String sql =
        """
        SELECT id,
               event_type,
               event_data::text AS payload_text,
               event_id,
               transaction_id,
               platform_id,
               created_at,
               retry_count,
               next_retry_at
        FROM relay_outbox
        WHERE id > :cursor
          AND processed_at IS NULL
          AND retry_count < :maxAttempts
        ORDER BY id
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cursor", cursor)
            .addValue("maxAttempts", maxAttempts)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markProcessed(long id, Instant processedAt) {
    final String sql =
        """
        UPDATE relay_outbox
        SET processed_at = :processedAt,
            published_at = :processedAt,
            next_retry_at = NULL,
            error_message = NULL
        WHERE id = :id
          AND processed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("processedAt", toTimestamp(processedAt))
            .addValue("id", id);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailure(long id, int retryCount, Instant nextRetryAt, String errorMessage) {
    final String sql =
        """
        UPDATE relay_outbox
        SET retry_count = :retryCount,
            next_retry_at = :nextRetryAt,
            error_message = :errorMessage
        WHERE id = :id
          AND processed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("retryCount", retryCount)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("errorMessage", errorMessage)
            .addValue("id", id);
    return jdbcTemplate.update(sql, params);
  }

  public int countExhausted(int maxAttempts) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM relay_outbox
        WHERE processed_at IS NULL
          AND retry_count >= :maxAttempts
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("maxAttempts", maxAttempts), Integer.class);
    return count == null ? 0 : count;
  }

  private OutboxRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxRecord(
        rs.getLong("id"),
        rs.getString("event_type"),
        rs.getString("payload_text"),
        rs.getString("event_id"),
        rs.getString("transaction_id"),
        rs.getString("platform_id"),
        toInstant(rs.getTimestamp("created_at")),
        rs.getInt("retry_count"),
        toInstant(rs.getTimestamp("next_retry_at")));
  }
}
