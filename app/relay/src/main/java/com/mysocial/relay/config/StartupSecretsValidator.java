package com.mysocial.relay.config;

import com.mysocial.relay.model.DeliveryConfig;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Reports the global provider credentials that are missing once the application is up. Missing
 * credentials disable a channel for platforms without their own configuration; they never stop
 * startup. The encryption master key is checked where it is decoded and does stop startup.
 */
@Component
@RequiredArgsConstructor
public class StartupSecretsValidator {

  private static final Logger logger = LoggerFactory.getLogger(StartupSecretsValidator.class);

  private final DeliveryProperties deliveryProperties;

  @EventListener(ApplicationReadyEvent.class)
  public void reportMissingCredentials() {
    final DeliveryConfig global = deliveryProperties.global();
    if (!global.hasApns()) {
      logger.warn("global APNs credentials incomplete; iOS push only for configured platforms");
    }
    if (!global.hasFcm()) {
      logger.warn("global FCM server key missing; Android push only for configured platforms");
    }
    if (!global.hasResend()) {
      logger.warn("global Resend credentials incomplete; email only for configured platforms");
    }
    logger.info("global delivery credentials {}", global);
  }
}
