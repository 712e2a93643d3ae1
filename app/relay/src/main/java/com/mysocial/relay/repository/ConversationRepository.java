/*
 * Where: Relay data access
 * What: relay_conversations creation, activity bump and participant queries
 */
package com.mysocial.relay.repository;

import static com.mysocial.common.JdbcTimestampUtils.toInstant;
import static com.mysocial.common.JdbcTimestampUtils.toTimestamp;

import com.mysocial.relay.model.ConversationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ConversationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean insertIfAbsent(ConversationRecord conversation) {
    final String sql =
        """
        INSERT INTO relay_conversations (id, participant_a, participant_b, created_at)
        VALUES (:id, :participantA, :participantB, :createdAt)
        ON CONFLICT (id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", conversation.id())
            .addValue("participantA", conversation.participantA())
            .addValue("participantB", conversation.participantB())
            .addValue("createdAt", toTimestamp(conversation.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int touchLastMessage(String conversationId, Instant messageAt) {
    // out-of-order redelivery must not move last_message_at backwards
    final String sql =
        """
        UPDATE relay_conversations
        SET last_message_at = GREATEST(COALESCE(last_message_at, :messageAt), :messageAt)
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("messageAt", toTimestamp(messageAt))
            .addValue("id", conversationId);
    return jdbcTemplate.update(sql, params);
  }

  public Optional<ConversationRecord> findById(String conversationId) {
    final String sql =
        """
        SELECT id, participant_a, participant_b, created_at, last_message_at
        FROM relay_conversations
        WHERE id = :id
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("id", conversationId), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<ConversationRecord> findByParticipant(String userAddress, int limit, int offset) {
    final String sql =
        """
        SELECT id, participant_a, participant_b, created_at, last_message_at
        FROM relay_conversations
        WHERE participant_a = :userAddress
           OR participant_b = :userAddress
        ORDER BY last_message_at DESC NULLS LAST, id
        LIMIT :limit
        OFFSET :offset
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userAddress", userAddress)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private ConversationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ConversationRecord(
        rs.getString("id"),
        rs.getString("participant_a"),
        rs.getString("participant_b"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_message_at")));
  }
}
