package com.mysocial.relay.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.common.event.RoutedEvent;
import com.mysocial.relay.config.MessagingProperties;
import com.mysocial.relay.config.RelayStreamProperties;
import com.mysocial.relay.model.ConsumerPipeline;
import com.mysocial.relay.service.DeadLetterService;
import com.mysocial.relay.service.RelayMetrics;
import com.mysocial.relay.service.messaging.MessageEventHandler;
import io.nats.client.Connection;
import io.nats.client.Message;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class MessageEventSubscriber extends AbstractJetStreamSubscriber {

  private final MessageEventHandler eventHandler;
  private final ObjectMapper objectMapper;

  public MessageEventSubscriber(
      Connection connection,
      RelayStreamBootstrap streamBootstrap,
      RelayStreamProperties streamProperties,
      MessagingProperties properties,
      DeadLetterService deadLetterService,
      RelayMetrics metrics,
      MessageEventHandler eventHandler,
      ObjectMapper objectMapper) {
    super(
        connection,
        streamBootstrap,
        streamProperties.eventsStream(),
        properties.consumer(),
        ConsumerPipeline.MESSAGING,
        deadLetterService,
        metrics);
    this.eventHandler = eventHandler;
    this.objectMapper = objectMapper;
  }

  @Override
  protected void process(Message message) {
    eventHandler.handle(readJson(objectMapper, message, RoutedEvent.class));
  }
}
