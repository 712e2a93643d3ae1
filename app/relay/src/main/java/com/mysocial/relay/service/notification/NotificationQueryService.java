/*
 * Where: Relay notification read path
 * What: list_notifications, unread_counts and mark_read for the authenticated user
 */
package com.mysocial.relay.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.relay.api.InvalidRelayRequestException;
import com.mysocial.relay.api.NotificationNotFoundException;
import com.mysocial.relay.api.PageParameters;
import com.mysocial.relay.api.response.NotificationListResponse;
import com.mysocial.relay.api.response.NotificationResponse;
import com.mysocial.relay.api.response.UnreadCountsResponse;
import com.mysocial.relay.model.NotificationRecord;
import com.mysocial.relay.model.UnreadCounts;
import com.mysocial.relay.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationQueryService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueryService.class);

  private final NotificationRepository notificationRepository;
  private final UnreadCounterService unreadCounterService;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public NotificationListResponse listNotifications(
      String userAddress, String platformId, PageParameters page) {
    final List<NotificationResponse> notifications =
        notificationRepository
            .findByUser(userAddress, blankToNull(platformId), page.limit(), page.offset())
            .stream()
            .map(this::toResponse)
            .toList();
    return new NotificationListResponse(userAddress, notifications, page.limit(), page.offset());
  }

  public UnreadCountsResponse unreadCounts(String userAddress, String platformId) {
    final UnreadCounts counts = unreadCounterService.counts(userAddress, blankToNull(platformId));
    return new UnreadCountsResponse(
        counts.totalUnread(),
        counts.platformId(),
        counts.platformUnread(),
        counts.platformId() == null ? counts.platformCounts() : null);
  }

  /**
   * Marks the notification read. Repeating the call returns the stored row and leaves the
   * counters alone.
   */
  public NotificationResponse markRead(String userAddress, String notificationId) {
    final UUID id = parseId(notificationId);
    final Optional<NotificationRecord> updated =
        notificationRepository.markRead(id, userAddress, Instant.now(clock));
    if (updated.isEmpty()) {
      final NotificationRecord existing =
          notificationRepository
              .findByIdAndUser(id, userAddress)
              .orElseThrow(() -> new NotificationNotFoundException(notificationId));
      return toResponse(existing);
    }
    final NotificationRecord notification = updated.get();
    if (notification.countersApplied()) {
      unreadCounterService.decrement(notification.userAddress(), notification.platformId());
    }
    logger.info("notification marked read notificationId={} user={}", id, userAddress);
    return toResponse(notification);
  }

  private NotificationResponse toResponse(NotificationRecord record) {
    return new NotificationResponse(
        record.id().toString(),
        record.sourceId(),
        record.platformId(),
        record.kind(),
        record.title(),
        record.body(),
        parsePayload(record),
        record.createdAt().toString(),
        record.readAt() == null ? null : record.readAt().toString(),
        record.isRead());
  }

  private JsonNode parsePayload(NotificationRecord record) {
    if (record.payloadJson() == null) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(record.payloadJson());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored notification payload is not JSON", ex);
    }
  }

  private static UUID parseId(String notificationId) {
    try {
      return UUID.fromString(notificationId);
    } catch (IllegalArgumentException ex) {
      throw new InvalidRelayRequestException("invalid notification id: " + notificationId);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
