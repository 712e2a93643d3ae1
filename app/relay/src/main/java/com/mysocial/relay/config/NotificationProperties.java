/*
 * Where: Relay configuration binding
 * What: Notification consumer, inbox cache and follow-up worker settings
 */
package com.mysocial.relay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "relay.notification")
@Validated
public record NotificationProperties(
    @Valid @NotNull JetStreamConsumerProperties consumer,
    @Positive int inboxSize,
    @NotNull Duration counterMarkerTtl,
    @Valid @NotNull FollowUp followUp) {

  public record FollowUp(
      boolean enabled,
      @NotNull Duration interval,
      @NotNull Duration grace,
      @Positive int batchSize) {}
}
