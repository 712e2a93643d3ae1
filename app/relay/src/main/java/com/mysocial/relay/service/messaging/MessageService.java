/*
 * Where: Relay messaging pipeline
 * What: Encrypts and stores direct messages, then fans them out through Redis
 * Why: Plaintext never reaches Postgres or Redis, and a replayed event stores nothing new
 */
package com.mysocial.relay.service.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.relay.api.InvalidRelayRequestException;
import com.mysocial.relay.api.request.SendMessageRequest;
import com.mysocial.relay.api.response.MessageResponse;
import com.mysocial.relay.config.MessagingProperties;
import com.mysocial.relay.crypto.ConversationKey;
import com.mysocial.relay.crypto.MessageEncryptionEngine;
import com.mysocial.relay.model.ConversationRecord;
import com.mysocial.relay.model.EncryptedContent;
import com.mysocial.relay.model.MessageRecord;
import com.mysocial.relay.repository.ConversationRepository;
import com.mysocial.relay.repository.MessageRepository;
import com.mysocial.relay.repository.RedisChatRepository;
import com.mysocial.relay.service.RelayMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class MessageService {

  public static final String DEFAULT_CONTENT_TYPE = "text";

  private static final Logger logger = LoggerFactory.getLogger(MessageService.class);
  private static final String SOURCE_EVENT = "event";
  private static final String SOURCE_API = "api";

  private final ConversationRepository conversationRepository;
  private final MessageRepository messageRepository;
  private final RedisChatRepository chatRepository;
  private final MessageEncryptionEngine encryptionEngine;
  private final TransactionTemplate transactionTemplate;
  private final MessagingProperties properties;
  private final RelayMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** send_message: stores a message written through the API by the authenticated sender. */
  public MessageResponse sendMessage(String senderAddress, SendMessageRequest request) {
    if (senderAddress.equals(request.recipientAddress())) {
      throw new InvalidRelayRequestException("cannot send a message to yourself");
    }
    if (request.content().length() > properties.maxContentLength()) {
      throw new InvalidRelayRequestException(
          "content exceeds " + properties.maxContentLength() + " characters");
    }
    final StoredMessage stored =
        store(
            senderAddress,
            request.recipientAddress(),
            request.content(),
            request.contentType(),
            null,
            Instant.now(clock));
    final MessageRecord message = stored.message();
    return new MessageResponse(
        message.id().toString(),
        message.conversationId(),
        message.senderAddress(),
        message.recipientAddress(),
        request.content(),
        message.contentType(),
        true,
        message.createdAt().toString());
  }

  /**
   * Encrypts and persists one message. The conversation upsert, the message insert and the
   * last_message_at bump share a transaction; Redis fanout runs after the commit.
   *
   * @param sourceId outbox id for event-sourced messages, null for API sends
   */
  public StoredMessage store(
      String senderAddress,
      String recipientAddress,
      String content,
      String contentType,
      Long sourceId,
      Instant createdAt) {
    final String conversationId = ConversationIds.canonical(senderAddress, recipientAddress);
    final ConversationKey key = encryptionEngine.deriveKey(conversationId);
    final EncryptedContent encrypted = encryptionEngine.encrypt(key, content);
    final MessageRecord message =
        new MessageRecord(
            UUID.randomUUID(),
            conversationId,
            senderAddress,
            recipientAddress,
            encrypted,
            contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType,
            sourceId,
            createdAt);
    final ConversationRecord conversation =
        new ConversationRecord(
            conversationId,
            ConversationIds.lowerParticipant(senderAddress, recipientAddress),
            ConversationIds.higherParticipant(senderAddress, recipientAddress),
            createdAt,
            null);
    final Boolean inserted =
        transactionTemplate.execute(
            status -> {
              conversationRepository.insertIfAbsent(conversation);
              if (!messageRepository.insertIfAbsent(message)) {
                return false;
              }
              conversationRepository.touchLastMessage(conversationId, createdAt);
              return true;
            });
    if (!Boolean.TRUE.equals(inserted)) {
      logger.debug(
          "message already stored sourceId={} conversationId={}", sourceId, conversationId);
      return new StoredMessage(message, false);
    }
    metrics.recordMessageStored(sourceId == null ? SOURCE_API : SOURCE_EVENT);
    fanOut(message);
    logger.info(
        "message stored messageId={} conversationId={} sourceId={}",
        message.id(),
        conversationId,
        sourceId);
    return new StoredMessage(message, true);
  }

  private void fanOut(MessageRecord message) {
    try {
      chatRepository.cacheRecentMessage(
          message.conversationId(), toJson(cacheEntry(message)), properties.chatCacheSize());
      chatRepository.appendToChatStream(
          message.recipientAddress(), toJson(streamEntry(message)), properties.streamMaxLength());
    } catch (DataAccessException | IllegalStateException ex) {
      // the row is committed; readers fall back to Postgres
      logger.warn(
          "message fanout failed messageId={} conversationId={}",
          message.id(),
          message.conversationId(),
          ex);
    }
  }

  private static Map<String, Object> cacheEntry(MessageRecord message) {
    final Base64.Encoder encoder = Base64.getEncoder();
    final Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("id", message.id().toString());
    entry.put("conversation_id", message.conversationId());
    entry.put("sender_address", message.senderAddress());
    entry.put("recipient_address", message.recipientAddress());
    entry.put("ciphertext", encoder.encodeToString(message.content().ciphertext()));
    entry.put("nonce", encoder.encodeToString(message.content().nonce()));
    entry.put("content_type", message.contentType());
    entry.put("created_at", message.createdAt().toString());
    return entry;
  }

  private static Map<String, Object> streamEntry(MessageRecord message) {
    final Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("type", "message");
    entry.put("message_id", message.id().toString());
    entry.put("conversation_id", message.conversationId());
    entry.put("sender_address", message.senderAddress());
    entry.put("created_at", message.createdAt().toString());
    return entry;
  }

  private String toJson(Map<String, Object> entry) {
    try {
      return objectMapper.writeValueAsString(entry);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("message fanout serialization failure", ex);
    }
  }
}
