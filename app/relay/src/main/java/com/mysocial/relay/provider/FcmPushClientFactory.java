package com.mysocial.relay.provider;

import com.mysocial.common.event.DeliveryChannel;
import com.mysocial.relay.config.ProviderEndpointProperties;
import com.mysocial.relay.model.DeliveryConfig;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class FcmPushClientFactory implements ProviderClientFactory {

  private final RestClient fcmRestClient;
  private final ProviderEndpointProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public FcmPushClientFactory(RestClient fcmRestClient, ProviderEndpointProperties properties) {
    this.fcmRestClient = fcmRestClient;
    this.properties = properties;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.FCM;
  }

  @Override
  public Optional<ProviderClient> create(DeliveryConfig config) {
    if (!config.hasFcm()) {
      return Optional.empty();
    }
    return Optional.of(
        new FcmPushClient(fcmRestClient, properties.fcmSendPath(), config.fcmServerKey()));
  }
}
