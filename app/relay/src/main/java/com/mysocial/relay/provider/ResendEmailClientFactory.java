package com.mysocial.relay.provider;

import com.mysocial.common.event.DeliveryChannel;
import com.mysocial.relay.config.ProviderEndpointProperties;
import com.mysocial.relay.model.DeliveryConfig;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class ResendEmailClientFactory implements ProviderClientFactory {

  private final RestClient resendRestClient;
  private final ProviderEndpointProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public ResendEmailClientFactory(
      RestClient resendRestClient, ProviderEndpointProperties properties) {
    this.resendRestClient = resendRestClient;
    this.properties = properties;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.EMAIL;
  }

  @Override
  public Optional<ProviderClient> create(DeliveryConfig config) {
    if (!config.hasResend()) {
      return Optional.empty();
    }
    return Optional.of(
        new ResendEmailClient(
            resendRestClient,
            properties.resendEmailsPath(),
            config.resendApiKey(),
            config.resendFromEmail()));
  }
}
