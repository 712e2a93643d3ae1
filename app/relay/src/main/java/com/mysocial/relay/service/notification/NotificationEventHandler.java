/*
 * Where: Relay notification pipeline
 * What: Turns a routed event into one notification row per recipient
 * Why: The unique (user_address, source_id) insert is what makes redelivery harmless
 */
package com.mysocial.relay.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.common.event.RoutedEvent;
import com.mysocial.relay.model.NotificationRecord;
import com.mysocial.relay.model.UserPreferences;
import com.mysocial.relay.repository.NotificationRepository;
import com.mysocial.relay.routing.RelayTopics;
import com.mysocial.relay.service.RelayEventPermanentException;
import com.mysocial.relay.service.RelayMetrics;
import com.mysocial.relay.service.user.UserPreferencesService;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NotificationEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final RecipientResolver recipientResolver;
  private final NotificationFormatter formatter;
  private final UserPreferencesService preferencesService;
  private final NotificationRepository notificationRepository;
  private final NotificationFanoutService fanoutService;
  private final TransactionTemplate transactionTemplate;
  private final RelayMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Persists notifications for the event. Exceptions thrown here happen before the insert
   * committed, so the caller may redeliver; counter and delivery failures after the commit are
   * left to the follow-up worker.
   *
   * @return notifications created by this call, empty for a replay
   */
  public List<NotificationRecord> handle(RoutedEvent event) {
    if (!RelayTopics.notifiesUsers(event.topic())) {
      logger.debug("topic does not produce notifications topic={}", event.topic());
      return List.of();
    }
    if (event.sourceId() <= 0) {
      throw new RelayEventPermanentException("routed event has no source_id");
    }
    final RecipientResolution resolution = recipientResolver.resolve(event);
    if (resolution.isEmpty()) {
      logger.debug(
          "no recipients for event sourceId={} eventType={}", event.sourceId(), event.eventType());
      return List.of();
    }
    final FormattedNotification formatted = formatter.format(resolution.kind(), event);
    final String payloadJson = serializePayload(event);
    final String platformId = platformIdOf(event);
    final Instant now = Instant.now(clock);
    final List<NotificationRecord> candidates = new ArrayList<>();
    for (String recipient : resolution.recipients()) {
      final UserPreferences preferences = preferencesService.find(recipient);
      if (preferences.mutes(resolution.kind())) {
        logger.debug("recipient muted kind user={} kind={}", recipient, resolution.kind());
        continue;
      }
      candidates.add(
          new NotificationRecord(
              UUID.randomUUID(),
              event.sourceId(),
              recipient,
              platformId,
              resolution.kind(),
              formatted.title(),
              formatted.body(),
              payloadJson,
              now,
              null,
              null,
              null));
    }
    final List<NotificationRecord> created =
        transactionTemplate.execute(status -> insertAll(candidates));
    if (created == null || created.isEmpty()) {
      return List.of();
    }
    for (NotificationRecord notification : created) {
      metrics.recordNotificationCreated();
      fanoutService.completeQuietly(notification);
    }
    logger.info(
        "notifications created sourceId={} kind={} count={}",
        event.sourceId(),
        resolution.kind(),
        created.size());
    return created;
  }

  private List<NotificationRecord> insertAll(List<NotificationRecord> candidates) {
    final List<NotificationRecord> created = new ArrayList<>();
    for (NotificationRecord candidate : candidates) {
      // a conflict means an earlier delivery already created this one
      if (notificationRepository.insertIfAbsent(candidate)) {
        created.add(candidate);
      }
    }
    return created;
  }

  private static String platformIdOf(RoutedEvent event) {
    if (event.platformId() != null && !event.platformId().isBlank()) {
      return event.platformId();
    }
    return event.payloadText("platform_id");
  }

  private String serializePayload(RoutedEvent event) {
    if (event.payload() == null) {
      return "{}";
    }
    try {
      return objectMapper.writeValueAsString(event.payload());
    } catch (JsonProcessingException ex) {
      throw new RelayEventPermanentException("notification payload serialization failure", ex);
    }
  }
}
