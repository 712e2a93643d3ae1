/*
 * Where: Relay notification pipeline
 * What: Post-commit steps of a notification: unread counters, inbox entry and delivery job
 * Why: Each step is stamped on the row so a partial failure can be finished later
 */
package com.mysocial.relay.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.common.event.DeliveryChannel;
import com.mysocial.common.event.DeliveryJob;
import com.mysocial.relay.config.NotificationProperties;
import com.mysocial.relay.config.RelayStreamProperties;
import com.mysocial.relay.model.NotificationRecord;
import com.mysocial.relay.model.UserPreferences;
import com.mysocial.relay.nats.RelayEventPublisher;
import com.mysocial.relay.repository.NotificationRepository;
import com.mysocial.relay.repository.RedisUnreadCounterRepository;
import com.mysocial.relay.repository.RedisUnreadCounterRepository.ApplyResult;
import com.mysocial.relay.service.user.UserPreferencesService;
import io.nats.client.JetStreamApiException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NotificationFanoutService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationFanoutService.class);
  private static final String DELIVERY_MESSAGE_ID_PREFIX = "delivery-";

  private final NotificationRepository notificationRepository;
  private final RedisUnreadCounterRepository counterRepository;
  private final UnreadCounterService unreadCounterService;
  private final UserPreferencesService preferencesService;
  private final RelayEventPublisher publisher;
  private final NotificationProperties properties;
  private final RelayStreamProperties streamProperties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Runs the missing steps and logs instead of throwing.
   *
   * @return true when both steps are stamped
   */
  public boolean completeQuietly(NotificationRecord notification) {
    try {
      complete(notification);
      return true;
    } catch (IOException | JetStreamApiException | RuntimeException ex) {
      logger.warn(
          "notification fanout incomplete; follow-up will retry notificationId={} user={}",
          notification.id(),
          notification.userAddress(),
          ex);
      return false;
    }
  }

  public void complete(NotificationRecord notification) throws IOException, JetStreamApiException {
    if (!notification.countersApplied()) {
      applyCounters(notification);
    }
    if (!notification.deliveryEmitted()) {
      emitDeliveryJob(notification);
    }
  }

  private void applyCounters(NotificationRecord notification) {
    // read_at is re-read because mark_read may have landed after this record was loaded
    final boolean unread =
        notificationRepository
            .findByIdAndUser(notification.id(), notification.userAddress())
            .map(current -> !current.isRead())
            .orElse(false);
    if (unread) {
      final ApplyResult result =
          counterRepository.applyNotification(
              notification.id(),
              notification.userAddress(),
              notification.platformId(),
              inboxEntry(notification),
              properties.inboxSize(),
              properties.counterMarkerTtl());
      if (result != ApplyResult.APPLIED) {
        logger.debug(
            "unread counters not incremented notificationId={} result={}",
            notification.id(),
            result);
      }
    }
    final Optional<NotificationRecord> stamped =
        notificationRepository.markCountersApplied(notification.id(), Instant.now(clock));
    if (unread && stamped.map(NotificationRecord::isRead).orElse(false)) {
      // mark_read committed before the stamp and skipped its decrement
      unreadCounterService.decrement(notification.userAddress(), notification.platformId());
    }
  }

  private void emitDeliveryJob(NotificationRecord notification)
      throws IOException, JetStreamApiException {
    final UserPreferences preferences = preferencesService.find(notification.userAddress());
    final List<DeliveryChannel> channels = requestedChannels(preferences);
    if (!channels.isEmpty()) {
      final DeliveryJob job =
          new DeliveryJob(
              notification.id().toString(),
              notification.userAddress(),
              notification.platformId(),
              channels,
              notification.kind(),
              notification.title(),
              notification.body(),
              deliveryData(notification),
              notification.createdAt().toString());
      publisher.publish(
          streamProperties.deliverySubject(),
          DELIVERY_MESSAGE_ID_PREFIX + notification.id(),
          notification.sourceId(),
          null,
          toJson(job));
    } else {
      logger.debug("delivery disabled by preferences notificationId={}", notification.id());
    }
    notificationRepository.markDeliveryEmitted(notification.id(), Instant.now(clock));
  }

  private static List<DeliveryChannel> requestedChannels(UserPreferences preferences) {
    final List<DeliveryChannel> channels = new ArrayList<>();
    if (preferences.pushEnabled()) {
      channels.add(DeliveryChannel.APNS);
      channels.add(DeliveryChannel.FCM);
    }
    if (preferences.emailEnabled()) {
      channels.add(DeliveryChannel.EMAIL);
    }
    return channels;
  }

  private static Map<String, String> deliveryData(NotificationRecord notification) {
    final Map<String, String> data = new LinkedHashMap<>();
    data.put("notification_id", notification.id().toString());
    data.put("kind", notification.kind());
    data.put("source_id", Long.toString(notification.sourceId()));
    if (notification.platformId() != null) {
      data.put("platform_id", notification.platformId());
    }
    return data;
  }

  private String inboxEntry(NotificationRecord notification) {
    final Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("id", notification.id().toString());
    entry.put("kind", notification.kind());
    entry.put("title", notification.title());
    entry.put("body", notification.body());
    entry.put("platform_id", notification.platformId());
    entry.put("source_id", notification.sourceId());
    entry.put("created_at", notification.createdAt().toString());
    return new String(toJson(entry), StandardCharsets.UTF_8);
  }

  private byte[] toJson(Object value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification fanout serialization failure", ex);
    }
  }
}
