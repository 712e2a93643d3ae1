/*
 * Where: Relay configuration binding
 * What: Process-wide master key for message encryption
 * Why: A missing key must stop the process at startup instead of storing unreadable messages
 */
package com.mysocial.relay.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "relay.encryption")
@Validated
public record EncryptionProperties(@NotBlank String masterKey) {

  @Override
  public String toString() {
    return "EncryptionProperties[masterKey=***]";
  }
}
