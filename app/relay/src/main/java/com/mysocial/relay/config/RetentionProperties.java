/*
 * Where: Relay configuration binding
 * What: Dead-letter retention window and cleanup schedule
 */
package com.mysocial.relay.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay.retention")
public record RetentionProperties(
    boolean enabled, int deadLetterRetentionDays, Duration cleanupInterval) {}
