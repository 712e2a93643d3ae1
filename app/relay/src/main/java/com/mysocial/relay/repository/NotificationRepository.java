/*
 * Where: Relay data access
 * What: relay_notifications insert with dedup, read-state updates, follow-up and unread queries
 * Why: The (user_address, source_id) unique key turns broker redelivery into a no-op
 */
package com.mysocial.relay.repository;

import static com.mysocial.common.JdbcTimestampUtils.toInstant;
import static com.mysocial.common.JdbcTimestampUtils.toTimestamp;

import com.mysocial.relay.model.NotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class NotificationRepository {

  private static final String COLUMNS =
      """
      id, source_id, user_address, platform_id, kind, title, body, payload::text AS payload_text,
      created_at, read_at, counters_applied_at, delivery_emitted_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public NotificationRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  /** Returns false when a notification for the same user and source already exists. */
  public boolean insertIfAbsent(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO relay_notifications (
          id,
          source_id,
          user_address,
          platform_id,
          kind,
          title,
          body,
          payload,
          created_at
        ) VALUES (
          :id,
          :sourceId,
          :userAddress,
          :platformId,
          :kind,
          :title,
          :body,
          CAST(:payload AS JSONB),
          :createdAt
        )
        ON CONFLICT (user_address, source_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("sourceId", record.sourceId())
            .addValue("userAddress", record.userAddress())
            .addValue("platformId", record.platformId())
            .addValue("kind", record.kind())
            .addValue("title", record.title())
            .addValue("body", record.body())
            .addValue("payload", record.payloadJson())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  /**
   * Stamps counters_applied_at. Serialized with {@link #markRead} on the row lock, so exactly one
   * of the two sees the other's column set.
   *
   * @return the stamped row with its current read_at, empty when it was already stamped
   */
  public Optional<NotificationRecord> markCountersApplied(UUID id, Instant appliedAt) {
    final String sql =
        """
        UPDATE relay_notifications
        SET counters_applied_at = :appliedAt
        WHERE id = :id
          AND counters_applied_at IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("appliedAt", toTimestamp(appliedAt))
            .addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markDeliveryEmitted(UUID id, Instant emittedAt) {
    final String sql =
        """
        UPDATE relay_notifications
        SET delivery_emitted_at = :emittedAt
        WHERE id = :id
          AND delivery_emitted_at IS NULL
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("emittedAt", toTimestamp(emittedAt))
            .addValue("id", id));
  }

  public List<NotificationRecord> findIncompleteCreatedBefore(Instant threshold, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM relay_notifications
            WHERE (counters_applied_at IS NULL OR delivery_emitted_at IS NULL)
              AND created_at <= :threshold
            ORDER BY created_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRecord> findByUser(
      String userAddress, String platformId, int limit, int offset) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM relay_notifications
            WHERE user_address = :userAddress
              AND (CAST(:platformId AS TEXT) IS NULL OR platform_id = :platformId)
            ORDER BY created_at DESC, id
            LIMIT :limit
            OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userAddress", userAddress)
            .addValue("platformId", platformId, Types.VARCHAR)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<NotificationRecord> findByIdAndUser(UUID id, String userAddress) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM relay_notifications
            WHERE id = :id
              AND user_address = :userAddress
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("userAddress", userAddress);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Sets read_at when the notification is still unread.
   *
   * @return the updated row, empty when it does not exist for this user or was already read
   */
  public Optional<NotificationRecord> markRead(UUID id, String userAddress, Instant readAt) {
    final String sql =
        """
        UPDATE relay_notifications
        SET read_at = :readAt
        WHERE id = :id
          AND user_address = :userAddress
          AND read_at IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("readAt", toTimestamp(readAt))
            .addValue("id", id)
            .addValue("userAddress", userAddress);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Unread rows whose counters were applied, which is what the Redis counters track. */
  public long countUnread(String userAddress) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM relay_notifications
        WHERE user_address = :userAddress
          AND read_at IS NULL
          AND counters_applied_at IS NOT NULL
        """;
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("userAddress", userAddress), Long.class);
    return count == null ? 0L : count;
  }

  /** Unread rows still waiting for their counters; a rebuild checks their Redis markers. */
  public List<NotificationRecord> findUnreadWithoutCounters(String userAddress) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM relay_notifications
            WHERE user_address = :userAddress
              AND read_at IS NULL
              AND counters_applied_at IS NULL
            ORDER BY created_at
            """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("userAddress", userAddress), this::mapRow);
  }

  public Map<String, Long> countUnreadByPlatform(String userAddress) {
    final String sql =
        """
        SELECT platform_id, COUNT(*) AS unread
        FROM relay_notifications
        WHERE user_address = :userAddress
          AND read_at IS NULL
          AND counters_applied_at IS NOT NULL
          AND platform_id IS NOT NULL
        GROUP BY platform_id
        ORDER BY platform_id
        """;
    final Map<String, Long> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("userAddress", userAddress),
        rs -> {
          counts.put(rs.getString("platform_id"), rs.getLong("unread"));
        });
    return counts;
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getObject("id", UUID.class),
        rs.getLong("source_id"),
        rs.getString("user_address"),
        rs.getString("platform_id"),
        rs.getString("kind"),
        rs.getString("title"),
        rs.getString("body"),
        rs.getString("payload_text"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("read_at")),
        toInstant(rs.getTimestamp("counters_applied_at")),
        toInstant(rs.getTimestamp("delivery_emitted_at")));
  }
}
