/*
 * Where: Relay configuration binding
 * What: JetStream stream names, subjects and duplicate window
 * Why: The poller publishes and the consumers subscribe against the same streams
 */
package com.mysocial.relay.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "relay.nats")
@Validated
public record RelayStreamProperties(
    @NotBlank String eventsStream,
    @NotBlank String eventsSubjects,
    @NotBlank String deliveryStream,
    @NotBlank String deliverySubject,
    @NotNull Duration duplicateWindow) {

  @AssertTrue(message = "relay.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    // Nats-Msg-Id dedup is disabled by a zero window
    return duplicateWindow != null && !duplicateWindow.isZero() && !duplicateWindow.isNegative();
  }
}
