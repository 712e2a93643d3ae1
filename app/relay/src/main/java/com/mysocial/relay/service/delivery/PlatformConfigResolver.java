/*
 * Where: Relay delivery pipeline
 * What: Merges per-platform provider credentials over the global ones
 * Why: A platform can override only the providers it manages and inherit the rest
 */
package com.mysocial.relay.service.delivery;

import com.mysocial.relay.config.DeliveryProperties;
import com.mysocial.relay.model.DeliveryConfig;
import com.mysocial.relay.repository.PlatformDeliveryConfigRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PlatformConfigResolver {

  private static final Logger logger = LoggerFactory.getLogger(PlatformConfigResolver.class);

  private final PlatformDeliveryConfigRepository repository;
  private final DeliveryProperties properties;

  /**
   * Returns the credential set used for a job of the given platform. Each field is the platform
   * value when non-blank, otherwise the global one; completeness is judged on the merged result.
   */
  public DeliveryConfig resolve(String platformId) {
    final DeliveryConfig global = properties.global();
    if (platformId == null || platformId.isBlank()) {
      return global;
    }
    final Optional<DeliveryConfig> platformConfig;
    try {
      platformConfig = repository.findByPlatformId(platformId);
    } catch (DataAccessException ex) {
      logger.warn(
          "platform delivery config lookup failed; using global config platformId={}",
          platformId,
          ex);
      return global;
    }
    return platformConfig.map(config -> config.orElse(global)).orElse(global);
  }
}
