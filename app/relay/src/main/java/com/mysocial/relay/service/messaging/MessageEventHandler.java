/*
 * Where: Relay messaging pipeline
 * What: Validates message.created events and hands them to MessageService, skipping other types
 */
package com.mysocial.relay.service.messaging;

import com.mysocial.common.event.RoutedEvent;
import com.mysocial.relay.config.MessagingProperties;
import com.mysocial.relay.service.RelayEventPermanentException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MessageEventHandler {

  static final String MESSAGE_CREATED = "message.created";

  private static final Logger logger = LoggerFactory.getLogger(MessageEventHandler.class);

  private final MessageService messageService;
  private final MessagingProperties properties;
  private final Clock clock;

  /**
   * Stores the message carried by a {@code message.created} event. Other {@code message.*} types
   * share the topic and are acknowledged without a write.
   */
  public Optional<StoredMessage> handle(RoutedEvent event) {
    if (!MESSAGE_CREATED.equals(event.eventType())) {
      logger.debug(
          "skipping message event type={} source_id={}", event.eventType(), event.sourceId());
      return Optional.empty();
    }
    if (event.sourceId() <= 0) {
      throw new RelayEventPermanentException("message event has no source_id");
    }
    final String sender = required(event, "sender_address");
    final String recipient = required(event, "recipient_address");
    final String content = required(event, "content");
    if (sender.equals(recipient)) {
      throw new RelayEventPermanentException("message sender and recipient are the same");
    }
    if (content.length() > properties.maxContentLength()) {
      throw new RelayEventPermanentException("message content is too long");
    }
    return Optional.of(
        messageService.store(
            sender,
            recipient,
            content,
            event.payloadText("content_type"),
            event.sourceId(),
            createdAt(event)));
  }

  private static String required(RoutedEvent event, String field) {
    final String value = event.payloadText(field);
    if (value == null) {
      throw new RelayEventPermanentException("message event is missing " + field);
    }
    return value;
  }

  private Instant createdAt(RoutedEvent event) {
    if (event.createdAt() == null) {
      return Instant.now(clock);
    }
    try {
      return Instant.parse(event.createdAt());
    } catch (DateTimeParseException ex) {
      throw new RelayEventPermanentException("invalid message created_at", ex);
    }
  }
}
