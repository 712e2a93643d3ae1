/*
 * Where: Relay configuration binding
 * What: Delivery consumer, per-channel retry, channel executor and global provider credentials
 * Why: Global credentials are the fallback for platforms without their own provider setup
 */
package com.mysocial.relay.config;

import com.mysocial.common.retry.BackoffPolicy;
import com.mysocial.relay.model.DeliveryConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "relay.delivery")
@Validated
public record DeliveryProperties(
    @Valid @NotNull JetStreamConsumerProperties consumer,
    @Positive int channelMaxAttempts,
    @NotNull BackoffPolicy channelBackoff,
    @Valid @NotNull Executor executor,
    DeliveryConfig global) {

  public DeliveryProperties {
    global = global == null ? DeliveryConfig.empty() : global;
  }

  /** The job is heartbeated before every send attempt, so one retry delay must fit in ack-wait. */
  @AssertTrue(
      message = "relay.delivery.consumer.ack-wait must exceed the longest channel retry delay")
  public boolean isAckWaitLongerThanChannelBackoff() {
    if (consumer == null || consumer.ackWait() == null || channelBackoff == null) {
      return false;
    }
    final long longestDelayMillis =
        (long) Math.ceil(channelBackoff.max().toMillis() * channelBackoff.jitterMax());
    return consumer.ackWait().toMillis()
        > Math.max(longestDelayMillis, channelBackoff.min().toMillis());
  }

  public record Executor(
      @Positive int corePoolSize,
      @Positive int maxPoolSize,
      @Positive int queueCapacity,
      @NotNull Duration awaitTermination) {}
}
