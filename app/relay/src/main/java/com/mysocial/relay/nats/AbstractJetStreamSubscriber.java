/*
 * Where: Relay NATS consumers
 * What: Durable push subscription with explicit ack, backoff nak and dead-lettering
 * Why: The three relay consumers share one redelivery policy
 */
package com.mysocial.relay.nats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mysocial.relay.config.JetStreamConsumerProperties;
import com.mysocial.relay.model.ConsumerPipeline;
import com.mysocial.relay.service.DeadLetterService;
import com.mysocial.relay.service.RelayEventPermanentException;
import com.mysocial.relay.service.RelayMetrics;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

public abstract class AbstractJetStreamSubscriber {

  private static final String MDC_PIPELINE = "pipeline";
  private static final String MDC_SOURCE_ID = "source_id";
  private static final String MDC_TRACE_ID = "trace_id";

  private final Logger logger = LoggerFactory.getLogger(getClass());
  private final Connection connection;
  private final RelayStreamBootstrap streamBootstrap;
  private final String stream;
  private final JetStreamConsumerProperties consumer;
  private final ConsumerPipeline pipeline;
  private final DeadLetterService deadLetterService;
  private final RelayMetrics metrics;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  protected AbstractJetStreamSubscriber(
      Connection connection,
      RelayStreamBootstrap streamBootstrap,
      String stream,
      JetStreamConsumerProperties consumer,
      ConsumerPipeline pipeline,
      DeadLetterService deadLetterService,
      RelayMetrics metrics) {
    this.connection = connection;
    this.streamBootstrap = streamBootstrap;
    this.stream = stream;
    this.consumer = consumer;
    this.pipeline = pipeline;
    this.deadLetterService = deadLetterService;
    this.metrics = metrics;
  }

  /** Handles one decoded message. Returning normally acks it. */
  protected abstract void process(Message message);

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      streamBootstrap.ensureStreams();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              consumer.subject(), dispatcher, this::handleMessage, false, pushSubscribeOptions());
      logger.info(
          "relay subscriber started pipeline={} subject={} stream={} durable={}",
          pipeline.tag(),
          consumer.subject(),
          stream,
          consumer.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
    started.set(false);
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    final NatsJetStreamMetaData metaData = metaDataOf(message);
    final long deliveredCount = metaData == null ? 1L : metaData.deliveredCount();
    final Long sourceId = sourceIdOf(message);
    MDC.put(MDC_PIPELINE, pipeline.tag());
    if (sourceId != null) {
      MDC.put(MDC_SOURCE_ID, Long.toString(sourceId));
    }
    final String traceId = header(message, RelayEventPublisher.HEADER_TRACE_ID);
    if (traceId != null) {
      MDC.put(MDC_TRACE_ID, traceId);
    }
    try {
      process(message);
      // explicit ack stops redelivery
      message.ack();
      metrics.recordConsumerResult(pipeline, "ack");
    } catch (RelayEventPermanentException ex) {
      logger.warn(
          "permanent failure while handling nats message subject={}", message.getSubject(), ex);
      deadLetterAndTerm(message, metaData, sourceId, deliveredCount, ex);
    } catch (RuntimeException ex) {
      if (deliveredCount >= consumer.maxDeliver()) {
        logger.warn(
            "nats message exhausted redelivery subject={} deliveredCount={}",
            message.getSubject(),
            deliveredCount,
            ex);
        deadLetterAndTerm(message, metaData, sourceId, deliveredCount, ex);
      } else {
        final Duration delay = redeliveryDelay(deliveredCount);
        logger.warn(
            "temporary failure while handling nats message subject={} deliveredCount={} retryIn={}",
            message.getSubject(),
            deliveredCount,
            delay,
            ex);
        nakSilently(message, delay);
      }
    } finally {
      MDC.remove(MDC_PIPELINE);
      MDC.remove(MDC_SOURCE_ID);
      MDC.remove(MDC_TRACE_ID);
    }
  }

  protected static <T> T readJson(ObjectMapper objectMapper, Message message, Class<T> type) {
    final byte[] data = message.getData();
    if (data == null || data.length == 0) {
      throw new RelayEventPermanentException("empty nats message body");
    }
    try {
      return objectMapper.readValue(data, type);
    } catch (JsonProcessingException ex) {
      throw new RelayEventPermanentException("malformed " + type.getSimpleName() + " body", ex);
    } catch (IOException ex) {
      throw new RelayEventPermanentException("unreadable " + type.getSimpleName() + " body", ex);
    }
  }

  private void deadLetterAndTerm(
      Message message,
      NatsJetStreamMetaData metaData,
      Long sourceId,
      long deliveredCount,
      RuntimeException cause) {
    try {
      deadLetterService.record(pipeline, message, metaData, sourceId, deliveredCount, cause);
    } catch (DataAccessException ex) {
      // the payload is not stored yet, so keep the message in the stream
      logger.error(
          "failed to store dead letter; message left for redelivery subject={}",
          message.getSubject(),
          ex);
      nakSilently(message, redeliveryDelay(deliveredCount));
      return;
    }
    termSilently(message);
  }

  private Duration redeliveryDelay(long deliveredCount) {
    return consumer.redeliveryBackoff().delayFor((int) Math.min(deliveredCount, Integer.MAX_VALUE));
  }

  private PushSubscribeOptions pushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            // ack-wait and max-deliver bound the redelivery window and count
            .ackWait(consumer.ackWait())
            .maxDeliver(consumer.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(stream)
        .durable(consumer.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private NatsJetStreamMetaData metaDataOf(Message message) {
    try {
      return message.metaData();
    } catch (IllegalStateException ex) {
      logger.debug("message carries no JetStream metadata subject={}", message.getSubject());
      return null;
    }
  }

  private static Long sourceIdOf(Message message) {
    final String value = header(message, RelayEventPublisher.HEADER_SOURCE_ID);
    if (value == null) {
      return null;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static String header(Message message, String name) {
    final Headers headers = message.getHeaders();
    if (headers == null) {
      return null;
    }
    final String value = headers.getFirst(name);
    return value == null || value.isBlank() ? null : value;
  }

  private void nakSilently(Message message, Duration delay) {
    try {
      message.nakWithDelay(delay);
      metrics.recordConsumerResult(pipeline, "nak");
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack nats message", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
      metrics.recordConsumerResult(pipeline, "term");
    } catch (IllegalStateException ex) {
      logger.warn("failed to term nats message", ex);
    }
  }
}
