package com.mysocial.relay.service.outbox;

import com.mysocial.relay.config.OutboxProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Reports OUT_OF_SERVICE after too many consecutive failed polls; the process keeps running. */
@Component
@ConditionalOnProperty(name = "relay.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class OutboxPollerHealthIndicator implements HealthIndicator {

  private final OutboxPoller poller;
  private final OutboxProperties properties;

  @Override
  public Health health() {
    final int failures = poller.consecutiveFailures();
    final Health.Builder builder =
        failures >= properties.degradedAfterFailures() ? Health.outOfService() : Health.up();
    return builder
        .withDetail("consecutiveFailedPolls", failures)
        .withDetail("degradedAfterFailures", properties.degradedAfterFailures())
        .withDetail("lockedBy", poller.lockedBy())
        .build();
  }
}
