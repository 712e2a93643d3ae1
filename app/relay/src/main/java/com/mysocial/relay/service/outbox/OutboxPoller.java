/*
 * Where: Relay outbox pipeline
 * What: Publishes relay_outbox rows to JetStream in id order and advances the durable cursor
 * Why: Rows are marked only after a PublishAck, so a crash republishes instead of losing events
 */
package com.mysocial.relay.service.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mysocial.common.TraceIds;
import com.mysocial.common.event.RoutedEvent;
import com.mysocial.relay.config.OutboxProperties;
import com.mysocial.relay.model.OutboxRecord;
import com.mysocial.relay.nats.RelayEventPublisher;
import com.mysocial.relay.repository.OutboxCursorRepository;
import com.mysocial.relay.repository.OutboxRepository;
import com.mysocial.relay.routing.TopicRouter;
import com.mysocial.relay.service.RelayMetrics;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStreamApiException;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@ConditionalOnProperty(name = "relay.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPoller {

  private static final Logger logger = LoggerFactory.getLogger(OutboxPoller.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String MESSAGE_ID_PREFIX = "outbox-";
  private static final String PAYLOAD_TRACE_ID = "trace_id";
  private static final String PAYLOAD_PLATFORM_ID = "platform_id";

  private final OutboxRepository outboxRepository;
  private final OutboxCursorRepository cursorRepository;
  private final TopicRouter topicRouter;
  private final RelayEventPublisher publisher;
  private final TransactionTemplate transactionTemplate;
  private final OutboxProperties properties;
  private final ObjectMapper objectMapper;
  private final RelayMetrics metrics;
  private final Clock clock;
  private final String lockedBy;
  private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed collaborators are shared and cannot be copied")
  public OutboxPoller(
      OutboxRepository outboxRepository,
      OutboxCursorRepository cursorRepository,
      TopicRouter topicRouter,
      RelayEventPublisher publisher,
      TransactionTemplate transactionTemplate,
      OutboxProperties properties,
      ObjectMapper objectMapper,
      RelayMetrics metrics,
      Clock clock) {
    this.outboxRepository = outboxRepository;
    this.cursorRepository = cursorRepository;
    this.topicRouter = topicRouter;
    this.publisher = publisher;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
    this.lockedBy = resolveLockedBy();
  }

  /** Runs one poll and tracks consecutive failures; store errors are logged, never thrown. */
  public OutboxPollResult poll() {
    OutboxPollResult result;
    try {
      result = pollOnce();
    } catch (DataAccessException ex) {
      logger.error("outbox poll failed on the store lockedBy={}", lockedBy, ex);
      result = OutboxPollResult.storeFailure();
    }
    final int failures =
        result.failed() ? consecutiveFailures.incrementAndGet() : resetFailures(result);
    metrics.updateOutboxFailedPolls(failures);
    return result;
  }

  @VisibleForTesting
  OutboxPollResult pollOnce() {
    final Instant now = Instant.now(clock);
    final OptionalLong cursor =
        cursorRepository.claimLease(
            properties.cursorName(), lockedBy, now, now.plus(properties.lease()));
    if (cursor.isEmpty()) {
      logger.debug("outbox cursor leased by another instance cursor={}", properties.cursorName());
      return OutboxPollResult.leaseNotHeld();
    }
    // ids are assigned at insert but become visible at commit, so a lower id can show up after
    // the cursor passed it; processed_at keeps the rescanned window from republishing
    final long scanFrom = Math.max(0L, cursor.getAsLong() - properties.lookbackIds());
    final List<OutboxRecord> records =
        outboxRepository.findUnprocessedAfter(
            scanFrom, properties.maxAttempts(), properties.batchSize());
    int published = 0;
    boolean failed = false;
    for (OutboxRecord record : records) {
      if (!record.isDueAt(now)) {
        // a later id must not overtake a record still waiting for its retry
        break;
      }
      final RoutedEvent event;
      try {
        event = toRoutedEvent(record);
      } catch (OutboxPayloadParseException ex) {
        markExhausted(record, ex);
        continue;
      }
      try {
        publish(record, event);
      } catch (IOException | JetStreamApiException | RuntimeException ex) {
        handlePublishFailure(record, ex, now);
        failed = true;
        break;
      }
      if (!markPublished(record)) {
        break;
      }
      metrics.recordOutboxPublished(record.createdAt(), Instant.now(clock));
      published++;
    }
    metrics.updateOutboxExhaustedCurrent(outboxRepository.countExhausted(properties.maxAttempts()));
    if (published > 0) {
      logger.debug("outbox batch published count={} lockedBy={}", published, lockedBy);
    }
    return new OutboxPollResult(true, published, failed);
  }

  /** Gives up the cursor lease so another instance can take over without waiting for expiry. */
  public void releaseLease() {
    try {
      cursorRepository.releaseLease(properties.cursorName(), lockedBy, Instant.now(clock));
    } catch (DataAccessException ex) {
      logger.warn("outbox cursor lease release failed lockedBy={}", lockedBy, ex);
    }
  }

  public int consecutiveFailures() {
    return consecutiveFailures.get();
  }

  String lockedBy() {
    return lockedBy;
  }

  private RoutedEvent toRoutedEvent(OutboxRecord record) {
    final JsonNode payload;
    try {
      payload = objectMapper.readTree(record.payloadJson());
    } catch (JsonProcessingException ex) {
      throw new OutboxPayloadParseException("outbox payload parse failure id=" + record.id(), ex);
    }
    if (payload == null || payload.isMissingNode()) {
      throw new OutboxPayloadParseException("outbox payload is empty id=" + record.id(), null);
    }
    return new RoutedEvent(
        topicRouter.route(record.eventType()),
        record.eventType(),
        payload,
        record.platformId() != null ? record.platformId() : text(payload, PAYLOAD_PLATFORM_ID),
        record.id(),
        record.eventId(),
        record.transactionId(),
        record.createdAt() == null ? null : record.createdAt().toString(),
        TraceIds.orNew(text(payload, PAYLOAD_TRACE_ID)));
  }

  private void publish(OutboxRecord record, RoutedEvent event)
      throws IOException, JetStreamApiException {
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(event);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("routed event serialization failure id=" + record.id(), ex);
    }
    MDC.put("trace_id", event.traceId());
    try {
      publisher.publish(
          event.topic(), MESSAGE_ID_PREFIX + record.id(), record.id(), event.traceId(), body);
    } finally {
      MDC.remove("trace_id");
    }
  }

  private boolean markPublished(OutboxRecord record) {
    final Instant processedAt = Instant.now(clock);
    final Boolean advanced =
        transactionTemplate.execute(
            status -> {
              outboxRepository.markProcessed(record.id(), processedAt);
              return cursorRepository.advance(
                      properties.cursorName(), lockedBy, record.id(), processedAt)
                  > 0;
            });
    if (!Boolean.TRUE.equals(advanced)) {
      logger.warn(
          "outbox publish succeeded but cursor lease was lost id={} lockedBy={}",
          record.id(),
          lockedBy);
      return false;
    }
    return true;
  }

  private void handlePublishFailure(OutboxRecord record, Exception ex, Instant now) {
    metrics.recordOutboxFailure();
    final int nextAttempt = record.retryCount() + 1;
    final boolean exhausted = nextAttempt >= properties.maxAttempts();
    final Instant nextRetryAt =
        exhausted ? null : now.plus(properties.backoff().delayFor(nextAttempt));
    outboxRepository.markFailure(record.id(), nextAttempt, nextRetryAt, truncateError(ex));
    if (exhausted) {
      logger.error(
          "outbox publish attempts exhausted; record left behind id={} eventType={} attempts={}",
          record.id(),
          record.eventType(),
          nextAttempt,
          ex);
    } else {
      logger.warn(
          "outbox publish retry scheduled id={} eventType={} attempt={} nextRetryAt={}",
          record.id(),
          record.eventType(),
          nextAttempt,
          nextRetryAt,
          ex);
    }
  }

  private void markExhausted(OutboxRecord record, OutboxPayloadParseException ex) {
    // a payload that cannot be parsed never succeeds on retry
    outboxRepository.markFailure(record.id(), properties.maxAttempts(), null, truncateError(ex));
    logger.error(
        "outbox payload parse failed; record left behind id={} eventType={}",
        record.id(),
        record.eventType(),
        ex);
  }

  private int resetFailures(OutboxPollResult result) {
    if (!result.leaseHeld()) {
      return consecutiveFailures.get();
    }
    final int previous = consecutiveFailures.getAndSet(0);
    if (previous > 0) {
      logger.info("outbox poller recovered after {} failed polls", previous);
    }
    return 0;
  }

  private String truncateError(Exception ex) {
    final String message = ex.getMessage();
    if (message == null) {
      return ex.getClass().getSimpleName();
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private static String text(JsonNode payload, String field) {
    if (!payload.hasNonNull(field)) {
      return null;
    }
    final String value = payload.get(field).asText();
    return value.isBlank() ? null : value;
  }

  private static String resolveLockedBy() {
    final String pid = Long.toString(ProcessHandle.current().pid());
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env + ":" + pid;
    }
    try {
      return InetAddress.getLocalHost().getHostName() + ":" + pid;
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME + ":" + pid;
    }
  }

  private static final class OutboxPayloadParseException extends RuntimeException {
    private OutboxPayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
