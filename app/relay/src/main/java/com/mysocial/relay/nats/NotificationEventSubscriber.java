/*
 * Where: Relay NATS consumers
 * What: Feeds routed events to the notification pipeline
 */
package com.mysocial.relay.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.common.event.RoutedEvent;
import com.mysocial.relay.config.NotificationProperties;
import com.mysocial.relay.config.RelayStreamProperties;
import com.mysocial.relay.model.ConsumerPipeline;
import com.mysocial.relay.routing.RelayTopics;
import com.mysocial.relay.service.DeadLetterService;
import com.mysocial.relay.service.RelayMetrics;
import com.mysocial.relay.service.notification.NotificationEventHandler;
import io.nats.client.Connection;
import io.nats.client.Message;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationEventSubscriber extends AbstractJetStreamSubscriber {

  private final NotificationEventHandler eventHandler;
  private final ObjectMapper objectMapper;

  public NotificationEventSubscriber(
      Connection connection,
      RelayStreamBootstrap streamBootstrap,
      RelayStreamProperties streamProperties,
      NotificationProperties properties,
      DeadLetterService deadLetterService,
      RelayMetrics metrics,
      NotificationEventHandler eventHandler,
      ObjectMapper objectMapper) {
    super(
        connection,
        streamBootstrap,
        streamProperties.eventsStream(),
        properties.consumer(),
        ConsumerPipeline.NOTIFICATION,
        deadLetterService,
        metrics);
    this.eventHandler = eventHandler;
    this.objectMapper = objectMapper;
  }

  @Override
  protected void process(Message message) {
    // the consumer filters on events.>, so message and unknown topics are acked untouched
    if (!RelayTopics.notifiesUsers(message.getSubject())) {
      return;
    }
    eventHandler.handle(readJson(objectMapper, message, RoutedEvent.class));
  }
}
