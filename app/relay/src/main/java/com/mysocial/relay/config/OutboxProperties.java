/*
 * Where: Relay configuration binding
 * What: Outbox poller cadence, batch size, retry bound, cursor lease, lookback and health threshold
 * Why: Poll latency and failure tolerance are environment concerns
 */
package com.mysocial.relay.config;

import com.mysocial.common.retry.BackoffPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "relay.outbox")
@Validated
public record OutboxProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int maxAttempts,
    @Valid @NotNull BackoffPolicy backoff,
    @NotNull Duration lease,
    @NotBlank String cursorName,
    @PositiveOrZero long lookbackIds,
    @Positive int degradedAfterFailures,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "relay.outbox.lease must be longer than relay.outbox.poll-interval")
  public boolean isLeaseLongerThanPollInterval() {
    if (lease == null || pollInterval == null) {
      return false;
    }
    return lease.compareTo(pollInterval) > 0;
  }
}
