package com.mysocial.relay.service.notification;

import static com.mysocial.relay.service.notification.NotificationEventFixtures.OBJECT_MAPPER;
import static com.mysocial.relay.service.notification.NotificationEventFixtures.event;
import static com.mysocial.relay.service.notification.NotificationEventFixtures.payload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class NotificationEventHandlerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private UserPreferencesService preferencesService;
  @Mock private NotificationRepository notificationRepository;
  @Mock private NotificationFanoutService fanoutService;
  @Mock private TransactionTemplate transactionTemplate;
  @Mock private RelayMetrics metrics;

  private NotificationEventHandler handler;

  @BeforeEach
  void setUp() {
    handler =
        new NotificationEventHandler(
            new RecipientResolver(),
            new NotificationFormatter(),
            preferencesService,
            notificationRepository,
            fanoutService,
            transactionTemplate,
            metrics,
            OBJECT_MAPPER,
            Clock.fixed(NOW, ZoneOffset.UTC));
    lenient()
        .when(transactionTemplate.execute(any()))
        .thenAnswer(
            invocation -> {
              final TransactionCallback<?> callback = invocation.getArgument(0);
              return callback.doInTransaction(null);
            });
  }

  @Test
  void reactionCreatesOneNotificationForPostOwner() {
    when(preferencesService.find("0xbob")).thenReturn(UserPreferences.defaults("0xbob"));
    when(notificationRepository.insertIfAbsent(any())).thenReturn(true);

    final List<NotificationRecord> created = handler.handle(reaction(100L, "platform-1"));

    assertThat(created).hasSize(1);
    final NotificationRecord notification = created.get(0);
    assertThat(notification.userAddress()).isEqualTo("0xbob");
    assertThat(notification.sourceId()).isEqualTo(100L);
    assertThat(notification.kind()).isEqualTo("reaction");
    assertThat(notification.title()).isEqualTo("New Reaction");
    assertThat(notification.platformId()).isEqualTo("platform-1");
    assertThat(notification.createdAt()).isEqualTo(NOW);
    assertThat(notification.isRead()).isFalse();
    assertThat(notification.payloadJson()).contains("\"reactor_address\":\"0xalice\"");
    verify(fanoutService).completeQuietly(notification);
    verify(metrics).recordNotificationCreated();
  }

  @Test
  void redeliveredEventCreatesNothing() {
    when(preferencesService.find("0xbob")).thenReturn(UserPreferences.defaults("0xbob"));
    when(notificationRepository.insertIfAbsent(any())).thenReturn(false);

    final List<NotificationRecord> created = handler.handle(reaction(100L, null));

    assertThat(created).isEmpty();
    verify(fanoutService, never()).completeQuietly(any());
    verify(metrics, never()).recordNotificationCreated();
  }

  @Test
  void mutedKindIsNotPersisted() {
    when(preferencesService.find("0xbob"))
        .thenReturn(new UserPreferences("0xbob", null, true, true, Set.of("reaction"), NOW));

    final List<NotificationRecord> created = handler.handle(reaction(101L, null));

    assertThat(created).isEmpty();
    verify(notificationRepository, never()).insertIfAbsent(any());
  }

  @Test
  void platformIdFallsBackToPayload() {
    when(preferencesService.find("0xbob")).thenReturn(UserPreferences.defaults("0xbob"));
    when(notificationRepository.insertIfAbsent(any())).thenReturn(true);
    final ObjectNode payload =
        payload()
            .put("following_address", "0xbob")
            .put("follower_address", "0xalice")
            .put("platform_id", "platform-7");

    handler.handle(event(RelayTopics.FOLLOW_CREATED, "follow.created", 102L, payload));

    final ArgumentCaptor<NotificationRecord> inserted =
        ArgumentCaptor.forClass(NotificationRecord.class);
    verify(notificationRepository).insertIfAbsent(inserted.capture());
    assertThat(inserted.getValue().platformId()).isEqualTo("platform-7");
    assertThat(inserted.getValue().kind()).isEqualTo("follow");
  }

  @Test
  void messageTopicIsIgnored() {
    final List<NotificationRecord> created =
        handler.handle(
            event(RelayTopics.MESSAGE_CREATED, "message.created", 103L, payload().put("a", 1)));

    assertThat(created).isEmpty();
    verifyNoInteractions(notificationRepository, preferencesService);
  }

  @Test
  void missingSourceIdIsPermanent() {
    assertThatThrownBy(() -> handler.handle(reaction(0L, null)))
        .isInstanceOf(RelayEventPermanentException.class);
  }

  private static RoutedEvent reaction(long sourceId, String platformId) {
    final ObjectNode payload =
        payload()
            .put("post_id", "post-1")
            .put("post_owner", "0xbob")
            .put("reactor_address", "0xalice");
    final RoutedEvent base = event(RelayTopics.POST_REACTION, "reaction.added", sourceId, payload);
    return new RoutedEvent(
        base.topic(),
        base.eventType(),
        base.payload(),
        platformId,
        base.sourceId(),
        base.eventId(),
        base.transactionId(),
        base.createdAt(),
        base.traceId());
  }
}
