/*
 * Where: Relay delivery providers
 * What: Sends Android push notifications through the FCM legacy HTTP endpoint
 */
package com.mysocial.relay.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mysocial.common.event.DeliveryChannel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Legacy {@code /fcm/send} client authenticated with a server key.
 *
 * <p>TODO: Google has shut the legacy endpoint down; move to the HTTP v1 API
 * ({@code /v1/projects/{project}/messages:send}) with OAuth2 tokens minted from a service account
 * and replace {@code fcm_server_key} with service-account credentials in the platform config.
 */
public class FcmPushClient implements ProviderClient {

  private static final Logger logger = LoggerFactory.getLogger(FcmPushClient.class);
  private static final String PROVIDER = "fcm";
  private static final Set<String> INVALID_TOKEN_ERRORS =
      Set.of("NotRegistered", "InvalidRegistration", "MismatchSenderId");
  private static final Set<String> RETRYABLE_ERRORS =
      Set.of("Unavailable", "InternalServerError", "DeviceMessageRateExceeded");

  private final RestClient restClient;
  private final String sendPath;
  private final String serverKey;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public FcmPushClient(RestClient restClient, String sendPath, String serverKey) {
    this.restClient = restClient;
    this.sendPath = sendPath;
    this.serverKey = serverKey;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.FCM;
  }

  @Override
  public void send(String destination, DeliveryContent content) {
    final FcmRequest request =
        new FcmRequest(
            destination, new FcmNotification(content.title(), content.body()), content.data());
    final FcmResponse response;
    try {
      response =
          restClient
              .post()
              .uri(sendPath)
              .header(HttpHeaders.AUTHORIZATION, "key=" + serverKey)
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(FcmResponse.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "fcm send failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw HttpProviderErrors.fromResponse(PROVIDER, ex);
    } catch (ResourceAccessException ex) {
      throw HttpProviderErrors.fromResourceAccess(PROVIDER, ex);
    } catch (RuntimeException ex) {
      throw new ProviderException(
          ProviderException.Reason.INVALID_RESPONSE, "fcm response parse failed", ex);
    }
    if (response == null) {
      throw new ProviderException(ProviderException.Reason.INVALID_RESPONSE, "fcm response empty");
    }
    if (response.failure() > 0) {
      throw resultError(response);
    }
  }

  private static ProviderException resultError(FcmResponse response) {
    final String error =
        response.results() == null || response.results().isEmpty()
            ? null
            : response.results().get(0).error();
    if (error != null && INVALID_TOKEN_ERRORS.contains(error)) {
      return new ProviderException(
          ProviderException.Reason.INVALID_DESTINATION, "fcm rejected device token error=" + error);
    }
    if (error != null && RETRYABLE_ERRORS.contains(error)) {
      return new ProviderException(
          ProviderException.Reason.UNAVAILABLE, "fcm temporarily failed error=" + error);
    }
    return new ProviderException(
        ProviderException.Reason.REJECTED, "fcm rejected message error=" + error);
  }

  record FcmRequest(String to, FcmNotification notification, Map<String, String> data) {}

  record FcmNotification(String title, String body) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  record FcmResponse(long multicastId, int success, int failure, List<FcmResult> results) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  record FcmResult(String messageId, String error) {}
}
