/*
 * Where: Relay configuration binding
 * What: Base URLs and timeouts of the HTTP delivery providers, APNs hosts included
 */
package com.mysocial.relay.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay.providers")
public record ProviderEndpointProperties(
    String resendBaseUrl,
    String resendEmailsPath,
    String fcmBaseUrl,
    String fcmSendPath,
    String apnsProductionUrl,
    String apnsSandboxUrl,
    Duration connectTimeout,
    Duration readTimeout) {

  public ProviderEndpointProperties {
    resendBaseUrl = isBlank(resendBaseUrl) ? "https://api.resend.com" : resendBaseUrl;
    resendEmailsPath = isBlank(resendEmailsPath) ? "/emails" : resendEmailsPath;
    fcmBaseUrl = isBlank(fcmBaseUrl) ? "https://fcm.googleapis.com" : fcmBaseUrl;
    fcmSendPath = isBlank(fcmSendPath) ? "/fcm/send" : fcmSendPath;
    apnsProductionUrl =
        isBlank(apnsProductionUrl) ? "https://api.push.apple.com" : apnsProductionUrl;
    apnsSandboxUrl =
        isBlank(apnsSandboxUrl) ? "https://api.sandbox.push.apple.com" : apnsSandboxUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
