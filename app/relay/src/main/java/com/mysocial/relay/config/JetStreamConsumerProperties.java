/*
 * Where: Relay configuration binding
 * What: Durable consumer settings shared by the three pipelines
 * Why: Ack wait, redelivery bound and nak backoff are tuned per pipeline
 */
package com.mysocial.relay.config;

import com.mysocial.common.retry.BackoffPolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

public record JetStreamConsumerProperties(
    @NotBlank String subject,
    @NotBlank String durable,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver,
    @NotNull BackoffPolicy redeliveryBackoff) {

  @AssertTrue(message = "consumer ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return ackWait != null && !ackWait.isZero() && !ackWait.isNegative();
  }
}
