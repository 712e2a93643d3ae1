/*
 * Where: Relay NATS publish
 * What: Publishes JSON bodies to JetStream with a dedup id and waits for the PublishAck
 * Why: A publish only counts once the stream acknowledged it
 */
package com.mysocial.relay.nats;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class RelayEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(RelayEventPublisher.class);

  public static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  public static final String HEADER_SOURCE_ID = "Relay-Source-Id";
  public static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;

  /**
   * @param messageId deduplication key inside the stream duplicate window
   * @param sourceId outbox id the body was derived from, or null
   * @throws IllegalStateException when the server returned no PublishAck
   */
  public PublishAck publish(
      String subject, String messageId, Long sourceId, String traceId, byte[] body)
      throws IOException, JetStreamApiException {
    final Headers headers = new Headers();
    headers.add(HEADER_MESSAGE_ID, messageId);
    if (sourceId != null) {
      headers.add(HEADER_SOURCE_ID, Long.toString(sourceId));
    }
    if (traceId != null) {
      headers.add(HEADER_TRACE_ID, traceId);
    }
    final PublishAck ack = jetStream.publish(subject, headers, body);
    if (ack == null) {
      throw new IllegalStateException("puback is missing subject=" + subject);
    }
    if (ack.isDuplicate()) {
      logger.debug("publish deduplicated by stream subject={} messageId={}", subject, messageId);
    }
    return ack;
  }
}
