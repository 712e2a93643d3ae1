/*
 * Where: Relay service layer
 * What: Deletes dead letters past their retention window
 * Why: Dead letters are kept for replay, not forever
 */
package com.mysocial.relay.service;

import com.mysocial.relay.config.RetentionProperties;
import com.mysocial.relay.repository.DeadLetterRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetentionService {

  private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);

  private final DeadLetterRepository deadLetterRepository;
  private final RetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.deadLetterRetentionDays()));
    final int deleted = deadLetterRepository.deleteOlderThan(threshold);
    logger.info("dead letter retention cleanup deleted={} threshold={}", deleted, threshold);
    return deleted;
  }
}
