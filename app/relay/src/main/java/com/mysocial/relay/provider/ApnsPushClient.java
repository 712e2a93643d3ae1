/*
 * Where: Relay delivery providers
 * What: Sends iOS push notifications through the APNs HTTP/2 API with a provider token
 * Why: Keeps the iOS channel in the same retry and metric flow as the other HTTP providers
 */
package com.mysocial.relay.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.common.event.DeliveryChannel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class ApnsPushClient implements ProviderClient {

  private static final Logger logger = LoggerFactory.getLogger(ApnsPushClient.class);
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final String PROVIDER = "apns";
  private static final String DEVICE_PATH = "/3/device/{token}";
  private static final String DEFAULT_BODY = "You have a new notification";
  private static final String EXPIRED_TOKEN = "ExpiredProviderToken";
  private static final Set<String> INVALID_TOKEN_REASONS =
      Set.of("BadDeviceToken", "Unregistered", "DeviceTokenNotForTopic");

  private final RestClient restClient;
  private final String endpoint;
  private final String bundleId;
  private final ApnsProviderToken providerToken;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient and the provider token are shared across clients")
  ApnsPushClient(
      RestClient restClient, String endpoint, String bundleId, ApnsProviderToken providerToken) {
    this.restClient = restClient;
    this.endpoint = endpoint;
    this.bundleId = bundleId;
    this.providerToken = providerToken;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.APNS;
  }

  public String endpoint() {
    return endpoint;
  }

  @Override
  public void send(String destination, DeliveryContent content) {
    if (destination == null || destination.isBlank()) {
      throw new ProviderException(
          ProviderException.Reason.INVALID_DESTINATION, "apns device token is required");
    }
    try {
      restClient
          .post()
          .uri(endpoint + DEVICE_PATH, destination)
          .header(HttpHeaders.AUTHORIZATION, "bearer " + providerToken.current())
          .header("apns-topic", bundleId)
          .header("apns-push-type", "alert")
          .header("apns-priority", "10")
          .contentType(MediaType.APPLICATION_JSON)
          .body(payload(content))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw responseError(ex);
    } catch (ResourceAccessException ex) {
      throw HttpProviderErrors.fromResourceAccess(PROVIDER, ex);
    }
  }

  static Map<String, Object> payload(DeliveryContent content) {
    final Map<String, Object> alert = new LinkedHashMap<>();
    if (content.title() != null) {
      alert.put("title", content.title());
    }
    alert.put("body", content.body() == null ? DEFAULT_BODY : content.body());
    final Map<String, Object> payload = new LinkedHashMap<>(content.data());
    payload.put("aps", Map.of("alert", alert));
    return payload;
  }

  private ProviderException responseError(RestClientResponseException ex) {
    final String reason = reason(ex);
    logger.warn(
        "apns send failed with http status={} reason={}", ex.getStatusCode().value(), reason);
    if (EXPIRED_TOKEN.equals(reason)) {
      providerToken.invalidate();
      return new ProviderException(
          ProviderException.Reason.UNAVAILABLE, "apns provider token expired", ex);
    }
    if (reason != null && INVALID_TOKEN_REASONS.contains(reason)) {
      return new ProviderException(
          ProviderException.Reason.INVALID_DESTINATION,
          "apns rejected device token reason=" + reason,
          ex);
    }
    return HttpProviderErrors.fromResponse(PROVIDER, ex);
  }

  private static String reason(RestClientResponseException ex) {
    final String body = ex.getResponseBodyAsString();
    if (body.isBlank()) {
      return null;
    }
    try {
      final JsonNode node = JSON.readTree(body);
      return node.hasNonNull("reason") ? node.get("reason").asText() : null;
    } catch (JsonProcessingException parseFailure) {
      logger.debug("apns error body is not json body={}", body, parseFailure);
      return null;
    }
  }
}
