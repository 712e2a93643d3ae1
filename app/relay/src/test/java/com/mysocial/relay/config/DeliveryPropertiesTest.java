package com.mysocial.relay.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.mysocial.common.retry.BackoffPolicy;
import com.mysocial.relay.model.DeliveryConfig;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DeliveryPropertiesTest {

  @Test
  void ackWaitMustOutlastTheLongestJitteredRetryDelay() {
    final BackoffPolicy backoff =
        new BackoffPolicy(
            Duration.ofMillis(500),
            Duration.ofSeconds(5),
            2.0d,
            0.8d,
            1.2d,
            Duration.ofMillis(200));

    assertThat(properties(Duration.ofSeconds(60), backoff).isAckWaitLongerThanChannelBackoff())
        .isTrue();
    assertThat(properties(Duration.ofSeconds(6), backoff).isAckWaitLongerThanChannelBackoff())
        .isFalse();
    assertThat(properties(Duration.ofSeconds(5), backoff).isAckWaitLongerThanChannelBackoff())
        .isFalse();
  }

  private static DeliveryProperties properties(Duration ackWait, BackoffPolicy channelBackoff) {
    return new DeliveryProperties(
        new JetStreamConsumerProperties(
            "notifications.delivery",
            "relay-delivery",
            ackWait,
            5,
            BackoffPolicy.fixed(Duration.ofSeconds(1))),
        3,
        channelBackoff,
        new DeliveryProperties.Executor(2, 4, 10, Duration.ofSeconds(5)),
        DeliveryConfig.empty());
  }
}
