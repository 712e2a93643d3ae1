/*
 * Where: Relay configuration binding
 * What: NATS connection settings
 * Why: Switch broker endpoints per environment
 */
package com.mysocial.relay.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Duration connectionTimeout, String connectionName) {

  public NatsProperties {
    url = url == null || url.isBlank() ? "nats://localhost:4222" : url;
    connectionTimeout = connectionTimeout == null ? Duration.ofSeconds(5) : connectionTimeout;
    connectionName =
        connectionName == null || connectionName.isBlank() ? "social-relay" : connectionName;
  }
}
