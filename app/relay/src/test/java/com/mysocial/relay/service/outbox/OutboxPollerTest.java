package com.mysocial.relay.service.outbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysocial.common.retry.BackoffPolicy;
import com.mysocial.relay.config.OutboxProperties;
import com.mysocial.relay.model.OutboxRecord;
import com.mysocial.relay.nats.RelayEventPublisher;
import com.mysocial.relay.repository.OutboxCursorRepository;
import com.mysocial.relay.repository.OutboxRepository;
import com.mysocial.relay.routing.TopicRouter;
import com.mysocial.relay.service.RelayMetrics;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class OutboxPollerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final String CURSOR = "relay-outbox";
  private static final OutboxProperties PROPERTIES =
      new OutboxProperties(
          true,
          Duration.ofMillis(150),
          100,
          3,
          BackoffPolicy.fixed(Duration.ofSeconds(5)),
          Duration.ofSeconds(30),
          CURSOR,
          10L,
          2,
          1000);

  @Mock private OutboxRepository outboxRepository;
  @Mock private OutboxCursorRepository cursorRepository;
  @Mock private RelayEventPublisher publisher;
  @Mock private TransactionTemplate transactionTemplate;
  @Mock private RelayMetrics metrics;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private OutboxPoller poller;

  @BeforeEach
  void setUp() {
    poller =
        new OutboxPoller(
            outboxRepository,
            cursorRepository,
            new TopicRouter(),
            publisher,
            transactionTemplate,
            PROPERTIES,
            objectMapper,
            metrics,
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
  void publishesInIdOrderAndAdvancesCursorAfterEachAck() throws Exception {
    leaseGranted(41L);
    when(outboxRepository.findUnprocessedAfter(31L, 3, 100))
        .thenReturn(
            List.of(
                record(42L, "post.created", "{\"post_id\":\"p1\",\"trace_id\":\"t-42\"}", 0, null),
                record(43L, "reaction.added", "{\"post_id\":\"p1\"}", 0, null)));
    when(cursorRepository.advance(eq(CURSOR), anyString(), anyLong(), eq(NOW))).thenReturn(1);

    final OutboxPollResult result = poller.poll();

    assertThat(result).isEqualTo(new OutboxPollResult(true, 2, false));
    final InOrder order = inOrder(publisher, outboxRepository, cursorRepository);
    order
        .verify(publisher)
        .publish(eq("events.post.created"), eq("outbox-42"), eq(42L), eq("t-42"), any());
    order.verify(outboxRepository).markProcessed(42L, NOW);
    order.verify(cursorRepository).advance(eq(CURSOR), anyString(), eq(42L), eq(NOW));
    order
        .verify(publisher)
        .publish(eq("events.post.reaction"), eq("outbox-43"), eq(43L), anyString(), any());
    order.verify(outboxRepository).markProcessed(43L, NOW);
    order.verify(cursorRepository).advance(eq(CURSOR), anyString(), eq(43L), eq(NOW));
    verify(metrics).updateOutboxFailedPolls(0);
  }

  @Test
  void lateCommittedRowBelowCursorIsStillPublished() throws Exception {
    leaseGranted(50L);
    when(outboxRepository.findUnprocessedAfter(40L, 3, 100))
        .thenReturn(
            List.of(
                record(45L, "post.created", "{}", 0, null),
                record(51L, "post.created", "{}", 0, null)));
    when(cursorRepository.advance(eq(CURSOR), anyString(), anyLong(), eq(NOW))).thenReturn(1);

    final OutboxPollResult result = poller.poll();

    assertThat(result.published()).isEqualTo(2);
    verify(publisher)
        .publish(eq("events.post.created"), eq("outbox-45"), eq(45L), anyString(), any());
    verify(outboxRepository).markProcessed(45L, NOW);
    verify(cursorRepository).advance(eq(CURSOR), anyString(), eq(45L), eq(NOW));
    verify(cursorRepository).advance(eq(CURSOR), anyString(), eq(51L), eq(NOW));
  }

  @Test
  void publishedBodyCarriesRoutingEnvelope() throws Exception {
    leaseGranted(0L);
    when(outboxRepository.findUnprocessedAfter(0L, 3, 100))
        .thenReturn(
            List.of(
                record(
                    7L,
                    "comment.created",
                    "{\"comment_id\":\"c1\",\"platform_id\":\"platform-9\"}",
                    0,
                    null)));
    when(cursorRepository.advance(eq(CURSOR), anyString(), eq(7L), eq(NOW))).thenReturn(1);

    poller.poll();

    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(publisher)
        .publish(eq("events.comment.created"), eq("outbox-7"), eq(7L), anyString(), body.capture());
    final JsonNode envelope = objectMapper.readTree(body.getValue());
    assertThat(envelope.get("topic").asText()).isEqualTo("events.comment.created");
    assertThat(envelope.get("event_type").asText()).isEqualTo("comment.created");
    assertThat(envelope.get("platform_id").asText()).isEqualTo("platform-9");
    assertThat(envelope.get("source_id").asLong()).isEqualTo(7L);
    assertThat(envelope.get("payload").get("comment_id").asText()).isEqualTo("c1");
    assertThat(envelope.get("trace_id").asText()).isNotBlank();
  }

  @Test
  void publishFailureSchedulesRetryAndStopsTheBatch() throws Exception {
    leaseGranted(0L);
    when(outboxRepository.findUnprocessedAfter(0L, 3, 100))
        .thenReturn(
            List.of(
                record(1L, "post.created", "{}", 0, null),
                record(2L, "post.created", "{}", 0, null)));
    when(publisher.publish(eq("events.post.created"), eq("outbox-1"), eq(1L), anyString(), any()))
        .thenThrow(new IOException("nats timeout"));

    final OutboxPollResult result = poller.poll();

    assertThat(result).isEqualTo(new OutboxPollResult(true, 0, true));
    verify(outboxRepository)
        .markFailure(1L, 1, NOW.plusSeconds(5), "nats timeout");
    verify(publisher, never()).publish(anyString(), eq("outbox-2"), anyLong(), anyString(), any());
    verify(outboxRepository, never()).markProcessed(anyLong(), any());
    verify(cursorRepository, never()).advance(anyString(), anyString(), anyLong(), any());
    verify(metrics).recordOutboxFailure();
    verify(metrics).updateOutboxFailedPolls(1);
    assertThat(poller.consecutiveFailures()).isEqualTo(1);
  }

  @Test
  void lastAttemptLeavesRecordExhausted() throws Exception {
    leaseGranted(0L);
    when(outboxRepository.findUnprocessedAfter(0L, 3, 100))
        .thenReturn(List.of(record(5L, "post.created", "{}", 2, NOW.minusSeconds(1))));
    when(publisher.publish(anyString(), anyString(), anyLong(), anyString(), any()))
        .thenThrow(new IllegalStateException("puback is missing"));
    when(outboxRepository.countExhausted(3)).thenReturn(1);

    poller.poll();

    verify(outboxRepository).markFailure(eq(5L), eq(3), isNull(), eq("puback is missing"));
    verify(metrics).updateOutboxExhaustedCurrent(1);
  }

  @Test
  void recordWaitingForRetryHoldsBackLaterRecords() throws Exception {
    leaseGranted(0L);
    when(outboxRepository.findUnprocessedAfter(0L, 3, 100))
        .thenReturn(
            List.of(
                record(1L, "post.created", "{}", 1, NOW.plusSeconds(3)),
                record(2L, "post.created", "{}", 0, null)));

    final OutboxPollResult result = poller.poll();

    assertThat(result).isEqualTo(new OutboxPollResult(true, 0, false));
    verify(publisher, never()).publish(anyString(), anyString(), anyLong(), anyString(), any());
  }

  @Test
  void unparseablePayloadIsExhaustedAndSkipped() throws Exception {
    leaseGranted(0L);
    when(outboxRepository.findUnprocessedAfter(0L, 3, 100))
        .thenReturn(
            List.of(
                record(1L, "post.created", "{not json", 0, null),
                record(2L, "post.created", "{}", 0, null)));
    when(cursorRepository.advance(eq(CURSOR), anyString(), eq(2L), eq(NOW))).thenReturn(1);

    final OutboxPollResult result = poller.poll();

    verify(outboxRepository).markFailure(eq(1L), eq(3), isNull(), anyString());
    verify(publisher)
        .publish(eq("events.post.created"), eq("outbox-2"), eq(2L), anyString(), any());
    assertThat(result.published()).isEqualTo(1);
  }

  @Test
  void lostLeaseStopsTheBatch() throws Exception {
    leaseGranted(0L);
    when(outboxRepository.findUnprocessedAfter(0L, 3, 100))
        .thenReturn(
            List.of(
                record(1L, "post.created", "{}", 0, null),
                record(2L, "post.created", "{}", 0, null)));
    when(cursorRepository.advance(eq(CURSOR), anyString(), eq(1L), eq(NOW))).thenReturn(0);

    final OutboxPollResult result = poller.poll();

    assertThat(result.published()).isZero();
    verify(publisher, never()).publish(anyString(), eq("outbox-2"), anyLong(), anyString(), any());
  }

  @Test
  void leaseHeldElsewhereSkipsThePoll() {
    when(cursorRepository.claimLease(eq(CURSOR), anyString(), eq(NOW), eq(NOW.plusSeconds(30))))
        .thenReturn(OptionalLong.empty());

    final OutboxPollResult result = poller.poll();

    assertThat(result).isEqualTo(OutboxPollResult.leaseNotHeld());
    verify(outboxRepository, never()).findUnprocessedAfter(anyLong(), anyInt(), anyInt());
    verify(metrics).updateOutboxFailedPolls(0);
  }

  @Test
  void storeFailuresDegradeHealthUntilRecovery() {
    when(cursorRepository.claimLease(eq(CURSOR), anyString(), any(), any()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"))
        .thenThrow(new DataAccessResourceFailureException("connection refused"))
        .thenReturn(OptionalLong.of(0L));
    when(outboxRepository.findUnprocessedAfter(0L, 3, 100)).thenReturn(List.of());
    final OutboxPollerHealthIndicator health = new OutboxPollerHealthIndicator(poller, PROPERTIES);

    poller.poll();
    assertThat(health.health().getStatus()).isEqualTo(Status.UP);
    poller.poll();
    assertThat(health.health().getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
    assertThat(health.health().getDetails()).containsEntry("consecutiveFailedPolls", 2);

    poller.poll();
    assertThat(poller.consecutiveFailures()).isZero();
    assertThat(health.health().getStatus()).isEqualTo(Status.UP);
  }

  @Test
  void releaseLeaseSurvivesStoreFailure() {
    when(cursorRepository.releaseLease(eq(CURSOR), anyString(), eq(NOW)))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    poller.releaseLease();

    verify(cursorRepository).releaseLease(CURSOR, poller.lockedBy(), NOW);
  }

  private void leaseGranted(long cursor) {
    when(cursorRepository.claimLease(eq(CURSOR), anyString(), eq(NOW), eq(NOW.plusSeconds(30))))
        .thenReturn(OptionalLong.of(cursor));
  }

  private static OutboxRecord record(
      long id, String eventType, String payload, int retryCount, Instant nextRetryAt) {
    return new OutboxRecord(
        id, eventType, payload, "evt-" + id, "tx-" + id, null, NOW.minusSeconds(2), retryCount,
        nextRetryAt);
  }
}
