/*
 * Where: Relay service layer
 * What: Persists JetStream messages that will not be processed
 * Why: A message is only TERMed after its payload is kept for replay
 */
package com.mysocial.relay.service;

import com.mysocial.relay.model.ConsumerPipeline;
import com.mysocial.relay.model.DeadLetter;
import com.mysocial.relay.repository.DeadLetterRepository;
import io.nats.client.Message;
import io.nats.client.impl.NatsJetStreamMetaData;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeadLetterService {

  private static final Logger logger = LoggerFactory.getLogger(DeadLetterService.class);
  private static final int ERROR_MESSAGE_MAX_LENGTH = 2000;

  private final DeadLetterRepository deadLetterRepository;
  private final RelayMetrics metrics;
  private final Clock clock;

  /**
   * Stores the message. A {@link org.springframework.dao.DataAccessException} propagates so the
   * caller can nak instead of terminating.
   */
  public void record(
      ConsumerPipeline pipeline,
      Message message,
      NatsJetStreamMetaData metaData,
      Long sourceId,
      long deliveredCount,
      Throwable cause) {
    final byte[] data = message.getData();
    final DeadLetter deadLetter =
        new DeadLetter(
            pipeline,
            message.getSubject(),
            metaData == null ? null : metaData.streamSequence(),
            sourceId,
            data == null ? "" : new String(data, StandardCharsets.UTF_8),
            describe(cause),
            deliveredCount);
    final boolean inserted =
        deadLetterRepository.insert(UUID.randomUUID(), deadLetter, Instant.now(clock));
    if (inserted) {
      metrics.recordDeadLetter(pipeline);
    }
    logger.error(
        "message moved to dead letters pipeline={} subject={} streamSequence={} sourceId={}"
            + " deliveredCount={} duplicate={}",
        pipeline.tag(),
        deadLetter.subject(),
        deadLetter.streamSequence(),
        sourceId,
        deliveredCount,
        !inserted,
        cause);
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown error";
    }
    final String message =
        cause.getMessage() == null
            ? cause.getClass().getName()
            : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    return message.length() <= ERROR_MESSAGE_MAX_LENGTH
        ? message
        : message.substring(0, ERROR_MESSAGE_MAX_LENGTH);
  }
}
