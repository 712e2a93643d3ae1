/*
 * Where: Relay configuration binding
 * What: Message consumer, chat cache and real-time stream settings
 */
package com.mysocial.relay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "relay.messaging")
@Validated
public record MessagingProperties(
    @Valid @NotNull JetStreamConsumerProperties consumer,
    @Positive int chatCacheSize,
    @Positive long streamMaxLength,
    @Positive int maxContentLength) {}
