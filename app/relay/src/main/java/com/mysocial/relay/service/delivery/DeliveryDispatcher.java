/*
 * Where: Relay delivery pipeline
 * What: Sends one delivery job over every applicable channel
 * Why: Channels are isolated; a failing provider never blocks or fails the others
 */
package com.mysocial.relay.service.delivery;

import com.mysocial.common.event.DeliveryChannel;
import com.mysocial.common.event.DeliveryJob;
import com.mysocial.common.retry.BackoffPolicy;
import com.mysocial.relay.config.DeliveryProperties;
import com.mysocial.relay.model.DeliveryConfig;
import com.mysocial.relay.model.DevicePlatform;
import com.mysocial.relay.model.UserPreferences;
import com.mysocial.relay.provider.DeliveryContent;
import com.mysocial.relay.provider.ProviderClient;
import com.mysocial.relay.provider.ProviderClientFactory;
import com.mysocial.relay.provider.ProviderException;
import com.mysocial.relay.service.RelayMetrics;
import com.mysocial.relay.service.user.DeviceTokenService;
import com.mysocial.relay.service.user.UserPreferencesService;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class DeliveryDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryDispatcher.class);

  private final PlatformConfigResolver configResolver;
  private final UserPreferencesService preferencesService;
  private final DeviceTokenService deviceTokenService;
  private final Map<DeliveryChannel, ProviderClientFactory> factories;
  private final Executor deliveryChannelExecutor;
  private final RelayMetrics metrics;
  private final int maxAttempts;
  private final BackoffPolicy backoff;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Executor is a shared Spring-managed component and cannot be copied")
  public DeliveryDispatcher(
      PlatformConfigResolver configResolver,
      UserPreferencesService preferencesService,
      DeviceTokenService deviceTokenService,
      List<ProviderClientFactory> factories,
      @Qualifier("deliveryChannelExecutor") Executor deliveryChannelExecutor,
      RelayMetrics metrics,
      DeliveryProperties properties) {
    this.configResolver = configResolver;
    this.preferencesService = preferencesService;
    this.deviceTokenService = deviceTokenService;
    this.factories = new EnumMap<>(DeliveryChannel.class);
    for (ProviderClientFactory factory : factories) {
      this.factories.put(factory.channel(), factory);
    }
    this.deliveryChannelExecutor = deliveryChannelExecutor;
    this.metrics = metrics;
    this.maxAttempts = properties.channelMaxAttempts();
    this.backoff = properties.channelBackoff();
  }

  public Map<DeliveryChannel, ChannelOutcome> dispatch(DeliveryJob job) {
    return dispatch(job, () -> {});
  }

  /**
   * Runs every requested channel and waits until each one is terminal. Channel failures are
   * logged and counted, never thrown; only a failure to read preferences or tokens propagates.
   *
   * @param heartbeat invoked from the channel threads before every send attempt, so the caller
   *     can extend the redelivery deadline of the job while destinations are still being sent
   * @return the outcome per requested channel
   */
  public Map<DeliveryChannel, ChannelOutcome> dispatch(DeliveryJob job, Runnable heartbeat) {
    final DeliveryConfig config = configResolver.resolve(job.platformId());
    final UserPreferences preferences = preferencesService.find(job.userAddress());
    final DeliveryContent content =
        new DeliveryContent(job.title(), job.body(), job.kind(), job.data());
    final Map<String, String> mdc = MDC.getCopyOfContextMap();

    final Map<DeliveryChannel, ChannelOutcome> outcomes = new EnumMap<>(DeliveryChannel.class);
    final Map<DeliveryChannel, CompletableFuture<ChannelOutcome>> running =
        new EnumMap<>(DeliveryChannel.class);
    for (DeliveryChannel channel : DeliveryChannel.values()) {
      if (!job.requests(channel)) {
        continue;
      }
      final ChannelPlan plan = plan(channel, job, preferences, config);
      if (plan.outcome() != null) {
        outcomes.put(channel, plan.outcome());
        continue;
      }
      running.put(
          channel,
          CompletableFuture.supplyAsync(
              () -> withMdc(mdc, () -> runChannel(job, plan, content, heartbeat)),
              deliveryChannelExecutor));
    }
    running.forEach((channel, future) -> outcomes.put(channel, future.join()));

    outcomes.forEach((channel, outcome) -> metrics.recordDeliveryChannel(channel, outcome.tag()));
    logger.info(
        "delivery job finished notificationId={} platformId={} outcomes={}",
        job.notificationId(),
        job.platformId(),
        outcomes);
    return outcomes;
  }

  private ChannelPlan plan(
      DeliveryChannel channel,
      DeliveryJob job,
      UserPreferences preferences,
      DeliveryConfig config) {
    if (!enabledByPreferences(channel, preferences)) {
      return ChannelPlan.terminal(ChannelOutcome.DISABLED);
    }
    final List<String> destinations = destinations(channel, job, preferences);
    if (destinations.isEmpty()) {
      return ChannelPlan.terminal(ChannelOutcome.NO_DESTINATION);
    }
    final ProviderClientFactory factory = factories.get(channel);
    if (factory == null) {
      return ChannelPlan.terminal(ChannelOutcome.NOT_CONFIGURED);
    }
    final Optional<ProviderClient> client;
    try {
      client = factory.create(config);
    } catch (ProviderException ex) {
      logger.error(
          "provider client could not be created channel={} platformId={} reason={}",
          channel,
          job.platformId(),
          ex.reason(),
          ex);
      return ChannelPlan.terminal(ChannelOutcome.MISCONFIGURED);
    }
    if (client.isEmpty()) {
      logger.debug("channel not configured channel={} platformId={}", channel, job.platformId());
      return ChannelPlan.terminal(ChannelOutcome.NOT_CONFIGURED);
    }
    return new ChannelPlan(client.get(), destinations, null);
  }

  private static boolean enabledByPreferences(
      DeliveryChannel channel, UserPreferences preferences) {
    return switch (channel) {
      case APNS, FCM -> preferences.pushEnabled();
      case EMAIL -> preferences.emailEnabled();
    };
  }

  private List<String> destinations(
      DeliveryChannel channel, DeliveryJob job, UserPreferences preferences) {
    return switch (channel) {
      case APNS ->
          deviceTokenService.tokensFor(job.userAddress(), DevicePlatform.IOS, job.platformId());
      case FCM ->
          deviceTokenService.tokensFor(
              job.userAddress(), DevicePlatform.ANDROID, job.platformId());
      case EMAIL ->
          preferences.hasEmailAddress() ? List.of(preferences.emailAddress()) : List.of();
    };
  }

  private ChannelOutcome runChannel(
      DeliveryJob job, ChannelPlan plan, DeliveryContent content, Runnable heartbeat) {
    final ProviderClient client = plan.client();
    int sent = 0;
    for (String destination : plan.destinations()) {
      if (sendWithRetry(job, client, destination, content, heartbeat)) {
        sent++;
      }
    }
    if (sent < plan.destinations().size()) {
      logger.warn(
          "channel delivered partially channel={} notificationId={} sent={} destinations={}",
          client.channel(),
          job.notificationId(),
          sent,
          plan.destinations().size());
    }
    return sent > 0 ? ChannelOutcome.SENT : ChannelOutcome.FAILED;
  }

  private boolean sendWithRetry(
      DeliveryJob job,
      ProviderClient client,
      String destination,
      DeliveryContent content,
      Runnable heartbeat) {
    for (int attempt = 1; ; attempt++) {
      beat(job, heartbeat);
      try {
        client.send(destination, content);
        return true;
      } catch (ProviderException ex) {
        if (!ex.retryable() || attempt >= maxAttempts) {
          logger.warn(
              "delivery failed channel={} notificationId={} reason={} attempts={}",
              client.channel(),
              job.notificationId(),
              ex.reason(),
              attempt,
              ex);
          return false;
        }
        final Duration delay = backoff.delayFor(attempt);
        logger.debug(
            "delivery retry scheduled channel={} notificationId={} reason={} delayMs={}",
            client.channel(),
            job.notificationId(),
            ex.reason(),
            delay.toMillis());
        if (!sleep(delay)) {
          return false;
        }
      } catch (RuntimeException ex) {
        logger.error(
            "delivery failed unexpectedly channel={} notificationId={}",
            client.channel(),
            job.notificationId(),
            ex);
        return false;
      }
    }
  }

  private static void beat(DeliveryJob job, Runnable heartbeat) {
    try {
      heartbeat.run();
    } catch (RuntimeException ex) {
      logger.warn("delivery heartbeat failed notificationId={}", job.notificationId(), ex);
    }
  }

  private static boolean sleep(Duration delay) {
    if (delay.isZero()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("delivery retry interrupted", ex);
      return false;
    }
  }

  private static <T> T withMdc(Map<String, String> mdc, Supplier<T> task) {
    final Map<String, String> previous = MDC.getCopyOfContextMap();
    if (mdc == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(mdc);
    }
    try {
      return task.get();
    } finally {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    }
  }

  private record ChannelPlan(
      ProviderClient client, List<String> destinations, ChannelOutcome outcome) {

    private ChannelPlan {
      destinations = destinations == null ? List.of() : new ArrayList<>(destinations);
    }

    static ChannelPlan terminal(ChannelOutcome outcome) {
      return new ChannelPlan(null, List.of(), outcome);
    }
  }
}
