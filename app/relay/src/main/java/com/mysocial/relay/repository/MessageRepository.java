/*
 * Where: Relay data access
 * What: relay_messages insert with source_id dedup and conversation history reads
 * Why: Only ciphertext and nonce are stored; plaintext never reaches the table
 */
package com.mysocial.relay.repository;

import static com.mysocial.common.JdbcTimestampUtils.toInstant;
import static com.mysocial.common.JdbcTimestampUtils.toTimestamp;

import com.mysocial.relay.model.EncryptedContent;
import com.mysocial.relay.model.MessageRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MessageRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Returns false when a message with the same upstream source_id was already stored. */
  public boolean insertIfAbsent(MessageRecord message) {
    final String sql =
        """
        INSERT INTO relay_messages (
          id,
          conversation_id,
          sender_address,
          recipient_address,
          ciphertext,
          nonce,
          content_type,
          source_id,
          created_at
        ) VALUES (
          :id,
          :conversationId,
          :senderAddress,
          :recipientAddress,
          :ciphertext,
          :nonce,
          :contentType,
          :sourceId,
          :createdAt
        )
        ON CONFLICT (source_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", message.id())
            .addValue("conversationId", message.conversationId())
            .addValue("senderAddress", message.senderAddress())
            .addValue("recipientAddress", message.recipientAddress())
            .addValue("ciphertext", message.content().ciphertext())
            .addValue("nonce", message.content().nonce())
            .addValue("contentType", message.contentType())
            .addValue("sourceId", message.sourceId(), Types.BIGINT)
            .addValue("createdAt", toTimestamp(message.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<MessageRecord> findByConversation(String conversationId, int limit, int offset) {
    final String sql =
        """
        SELECT id,
               conversation_id,
               sender_address,
               recipient_address,
               ciphertext,
               nonce,
               content_type,
               source_id,
               created_at
        FROM relay_messages
        WHERE conversation_id = :conversationId
        ORDER BY created_at DESC, id
        LIMIT :limit
        OFFSET :offset
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("conversationId", conversationId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MessageRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MessageRecord(
        rs.getObject("id", UUID.class),
        rs.getString("conversation_id"),
        rs.getString("sender_address"),
        rs.getString("recipient_address"),
        new EncryptedContent(rs.getBytes("ciphertext"), rs.getBytes("nonce")),
        rs.getString("content_type"),
        rs.getObject("source_id", Long.class),
        toInstant(rs.getTimestamp("created_at")));
  }
}
