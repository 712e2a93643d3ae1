package com.mysocial.relay.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.common.event.DeliveryJob;
import com.mysocial.relay.config.DeliveryProperties;
import com.mysocial.relay.config.RelayStreamProperties;
import com.mysocial.relay.model.ConsumerPipeline;
import com.mysocial.relay.service.DeadLetterService;
import com.mysocial.relay.service.RelayMetrics;
import com.mysocial.relay.service.delivery.DeliveryDispatcher;
import io.nats.client.Connection;
import io.nats.client.Message;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class DeliveryJobSubscriber extends AbstractJetStreamSubscriber {

  private final DeliveryDispatcher dispatcher;
  private final ObjectMapper objectMapper;

  public DeliveryJobSubscriber(
      Connection connection,
      RelayStreamBootstrap streamBootstrap,
      RelayStreamProperties streamProperties,
      DeliveryProperties properties,
      DeadLetterService deadLetterService,
      RelayMetrics metrics,
      DeliveryDispatcher dispatcher,
      ObjectMapper objectMapper) {
    super(
        connection,
        streamBootstrap,
        streamProperties.deliveryStream(),
        properties.consumer(),
        ConsumerPipeline.DELIVERY,
        deadLetterService,
        metrics);
    this.dispatcher = dispatcher;
    this.objectMapper = objectMapper;
  }

  @Override
  protected void process(Message message) {
    // blocks until every channel is terminal; channel failures never fail the job.
    // inProgress resets the ack-wait timer so a long job is not redelivered while still running
    dispatcher.dispatch(readJson(objectMapper, message, DeliveryJob.class), message::inProgress);
  }
}
