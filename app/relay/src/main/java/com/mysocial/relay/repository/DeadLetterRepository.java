/*
 * Where: Relay data access
 * What: Stores consumer messages that failed permanently or exhausted redelivery
 * Why: Failed events stay inspectable instead of disappearing with a TERM
 */
package com.mysocial.relay.repository;

import static com.mysocial.common.JdbcTimestampUtils.toTimestamp;

import com.mysocial.relay.model.DeadLetter;
import java.sql.Types;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeadLetterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean insert(UUID id, DeadLetter deadLetter, Instant createdAt) {
    final String sql =
        """
        INSERT INTO relay_dead_letters (
          id,
          pipeline,
          subject,
          stream_sequence,
          source_id,
          payload,
          error_message,
          delivered_count,
          created_at
        ) VALUES (
          :id,
          :pipeline,
          :subject,
          :streamSequence,
          :sourceId,
          :payload,
          :errorMessage,
          :deliveredCount,
          :createdAt
        )
        ON CONFLICT (pipeline, stream_sequence) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("pipeline", deadLetter.pipeline().tag())
            .addValue("subject", deadLetter.subject())
            .addValue("streamSequence", deadLetter.streamSequence(), Types.BIGINT)
            .addValue("sourceId", deadLetter.sourceId(), Types.BIGINT)
            .addValue("payload", deadLetter.payload())
            .addValue("errorMessage", deadLetter.errorMessage())
            .addValue("deliveredCount", deadLetter.deliveredCount())
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM relay_dead_letters
        WHERE created_at < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }
}
