/*
 * Where: Relay NATS bootstrap
 * What: Creates or updates the event and delivery streams before anything publishes
 * Why: Nats-Msg-Id deduplication only works inside a stream duplicate window
 */
package com.mysocial.relay.nats;

import com.mysocial.relay.config.RelayStreamProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class RelayStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(RelayStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final RelayStreamProperties properties;
  private final AtomicBoolean ensured = new AtomicBoolean(false);

  @PostConstruct
  public void ensureStreams() {
    if (ensured.get()) {
      return;
    }
    try {
      final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
      upsertStream(
          jetStreamManagement,
          streamConfiguration(properties.eventsStream(), properties.eventsSubjects()));
      upsertStream(
          jetStreamManagement,
          streamConfiguration(properties.deliveryStream(), properties.deliverySubject()));
      ensured.set(true);
      logger.info(
          "relay streams ensured eventsStream={} deliveryStream={} duplicateWindow={}",
          properties.eventsStream(),
          properties.deliveryStream(),
          properties.duplicateWindow());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream streams", ex);
    }
  }

  private StreamConfiguration streamConfiguration(String stream, String subject) {
    return StreamConfiguration.builder()
        .name(stream)
        .subjects(subject)
        .storageType(StorageType.File)
        .duplicateWindow(properties.duplicateWindow())
        .build();
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
      logger.info("relay stream created stream={}", streamConfiguration.getName());
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }
}
