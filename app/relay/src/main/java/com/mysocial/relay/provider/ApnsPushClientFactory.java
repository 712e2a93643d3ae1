package com.mysocial.relay.provider;

import com.mysocial.common.event.DeliveryChannel;
import com.mysocial.relay.config.ProviderEndpointProperties;
import com.mysocial.relay.model.DeliveryConfig;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class ApnsPushClientFactory implements ProviderClientFactory {

  private final RestClient apnsRestClient;
  private final ProviderEndpointProperties properties;
  private final Clock clock;
  // one provider token per signing identity, reused across jobs until it ages out
  private final Map<String, ApnsProviderToken> providerTokens = new ConcurrentHashMap<>();

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public ApnsPushClientFactory(
      RestClient apnsRestClient, ProviderEndpointProperties properties, Clock clock) {
    this.apnsRestClient = apnsRestClient;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.APNS;
  }

  /**
   * Builds an APNs client when the credential set is complete.
   *
   * @throws ProviderException with {@code MISCONFIGURED} when the key content is not valid base64,
   *     the key path cannot be read or the key is not a PKCS#8 EC key
   */
  @Override
  public Optional<ProviderClient> create(DeliveryConfig config) {
    if (!config.hasApns()) {
      return Optional.empty();
    }
    final String pem = readKeyMaterial(config);
    final ApnsProviderToken token =
        providerTokens.computeIfAbsent(
            config.apnsKeyId() + ":" + config.apnsTeamId() + ":" + pem.hashCode(),
            ignored ->
                new ApnsProviderToken(
                    config.apnsKeyId(),
                    config.apnsTeamId(),
                    ApnsProviderToken.parsePrivateKey(pem),
                    clock));
    return Optional.of(
        new ApnsPushClient(apnsRestClient, endpointFor(config), config.apnsBundleId(), token));
  }

  String endpointFor(DeliveryConfig config) {
    final String bundle = config.apnsBundleId().toLowerCase(Locale.ROOT);
    final boolean sandbox =
        !config.isApnsProduction() || bundle.contains("sandbox") || bundle.contains("dev");
    return sandbox ? properties.apnsSandboxUrl() : properties.apnsProductionUrl();
  }

  private static String readKeyMaterial(DeliveryConfig config) {
    final String content = config.apnsKeyContent();
    if (content != null && !content.isBlank()) {
      try {
        return new String(Base64.getDecoder().decode(content.strip()), StandardCharsets.UTF_8);
      } catch (IllegalArgumentException ex) {
        throw new ProviderException(
            ProviderException.Reason.MISCONFIGURED, "apns key content is not valid base64", ex);
      }
    }
    try {
      return Files.readString(Path.of(config.apnsKeyPath()), StandardCharsets.UTF_8);
    } catch (InvalidPathException ex) {
      throw new ProviderException(
          ProviderException.Reason.MISCONFIGURED, "apns key path is invalid", ex);
    } catch (IOException ex) {
      throw new ProviderException(
          ProviderException.Reason.MISCONFIGURED,
          "apns key file is not readable: " + config.apnsKeyPath(),
          ex);
    }
  }
}
