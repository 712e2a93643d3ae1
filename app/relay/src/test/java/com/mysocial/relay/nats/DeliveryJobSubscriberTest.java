package com.mysocial.relay.nats;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.common.event.DeliveryChannel;
import com.mysocial.common.event.DeliveryJob;
import com.mysocial.common.retry.BackoffPolicy;
import com.mysocial.relay.config.DeliveryProperties;
import com.mysocial.relay.config.JetStreamConsumerProperties;
import com.mysocial.relay.config.RelayStreamProperties;
import com.mysocial.relay.model.DeliveryConfig;
import com.mysocial.relay.service.DeadLetterService;
import com.mysocial.relay.service.RelayMetrics;
import com.mysocial.relay.service.delivery.DeliveryDispatcher;
import io.nats.client.Connection;
import io.nats.client.Message;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeliveryJobSubscriberTest {

  private static final DeliveryJob JOB =
      new DeliveryJob(
          "n-1",
          "0xbob",
          "platform-1",
          List.of(DeliveryChannel.APNS),
          "reaction",
          "New Reaction",
          "Someone reacted to your post",
          Map.of("notification_id", "n-1"),
          "2026-01-17T00:00:00Z");

  @Mock private Connection connection;
  @Mock private RelayStreamBootstrap streamBootstrap;
  @Mock private DeadLetterService deadLetterService;
  @Mock private RelayMetrics metrics;
  @Mock private DeliveryDispatcher dispatcher;
  @Mock private Message message;

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void dispatchHeartbeatMarksTheMessageInProgress() throws Exception {
    final DeliveryJobSubscriber subscriber =
        new DeliveryJobSubscriber(
            connection,
            streamBootstrap,
            new RelayStreamProperties(
                "RELAY_EVENTS",
                "events.>",
                "RELAY_DELIVERY",
                "notifications.delivery",
                Duration.ofMinutes(2)),
            new DeliveryProperties(
                new JetStreamConsumerProperties(
                    "notifications.delivery",
                    "relay-delivery",
                    Duration.ofSeconds(60),
                    5,
                    BackoffPolicy.fixed(Duration.ofSeconds(1))),
                3,
                BackoffPolicy.fixed(Duration.ZERO),
                new DeliveryProperties.Executor(2, 4, 10, Duration.ofSeconds(5)),
                DeliveryConfig.empty()),
            deadLetterService,
            metrics,
            dispatcher,
            objectMapper);
    when(message.getData()).thenReturn(objectMapper.writeValueAsBytes(JOB));
    doAnswer(
            invocation -> {
              final Runnable heartbeat = invocation.getArgument(1);
              heartbeat.run();
              heartbeat.run();
              return Map.of();
            })
        .when(dispatcher)
        .dispatch(eq(JOB), any(Runnable.class));

    subscriber.process(message);

    verify(message, times(2)).inProgress();
  }
}
