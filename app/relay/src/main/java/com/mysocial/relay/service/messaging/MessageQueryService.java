/*
 * Where: Relay messaging read path
 * What: list_messages and list_conversations for the authenticated user
 * Why: Participation is checked before any ciphertext is decrypted
 */
package com.mysocial.relay.service.messaging;

import com.mysocial.relay.api.ConversationAccessDeniedException;
import com.mysocial.relay.api.ConversationNotFoundException;
import com.mysocial.relay.api.PageParameters;
import com.mysocial.relay.api.response.ConversationListResponse;
import com.mysocial.relay.api.response.ConversationResponse;
import com.mysocial.relay.api.response.MessageListResponse;
import com.mysocial.relay.api.response.MessageResponse;
import com.mysocial.relay.crypto.ConversationKey;
import com.mysocial.relay.crypto.MessageAuthenticationException;
import com.mysocial.relay.crypto.MessageEncryptionEngine;
import com.mysocial.relay.model.ConversationRecord;
import com.mysocial.relay.model.MessageRecord;
import com.mysocial.relay.repository.ConversationRepository;
import com.mysocial.relay.repository.MessageRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MessageQueryService {

  private static final Logger logger = LoggerFactory.getLogger(MessageQueryService.class);

  private final ConversationRepository conversationRepository;
  private final MessageRepository messageRepository;
  private final MessageEncryptionEngine encryptionEngine;

  public MessageListResponse listMessages(
      String userAddress, String conversationId, PageParameters page) {
    final ConversationRecord conversation =
        conversationRepository
            .findById(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    if (!conversation.hasParticipant(userAddress)) {
      throw new ConversationAccessDeniedException(conversationId);
    }
    final ConversationKey key = encryptionEngine.deriveKey(conversationId);
    final List<MessageResponse> messages =
        messageRepository.findByConversation(conversationId, page.limit(), page.offset()).stream()
            .map(message -> toResponse(key, message))
            .toList();
    return new MessageListResponse(conversationId, messages, page.limit(), page.offset());
  }

  public ConversationListResponse listConversations(String userAddress, PageParameters page) {
    final List<ConversationResponse> conversations =
        conversationRepository.findByParticipant(userAddress, page.limit(), page.offset()).stream()
            .map(
                conversation ->
                    new ConversationResponse(
                        conversation.id(),
                        conversation.otherParticipant(userAddress),
                        conversation.createdAt().toString(),
                        conversation.lastMessageAt() == null
                            ? null
                            : conversation.lastMessageAt().toString()))
            .toList();
    return new ConversationListResponse(conversations, page.limit(), page.offset());
  }

  private MessageResponse toResponse(ConversationKey key, MessageRecord message) {
    String content;
    boolean available;
    try {
      content = encryptionEngine.decrypt(key, message.content());
      available = true;
    } catch (MessageAuthenticationException ex) {
      // one tampered row must not hide the rest of the conversation
      logger.error(
          "message failed authentication messageId={} conversationId={}",
          message.id(),
          message.conversationId(),
          ex);
      content = null;
      available = false;
    }
    return new MessageResponse(
        message.id().toString(),
        message.conversationId(),
        message.senderAddress(),
        message.recipientAddress(),
        content,
        message.contentType(),
        available,
        message.createdAt().toString());
  }
}
