/*
 * Where: Relay notification pipeline
 * What: Finishes notifications whose counters or delivery job are still missing
 * Why: Post-commit failures are acked on the broker, so the table is the retry source
 */
package com.mysocial.relay.service.notification;

import com.mysocial.relay.config.NotificationProperties;
import com.mysocial.relay.model.NotificationRecord;
import com.mysocial.relay.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NotificationFollowUpService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationFollowUpService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationFanoutService fanoutService;
  private final NotificationProperties properties;
  private final Clock clock;

  /** @return number of notifications completed in this pass */
  public int completePending() {
    final NotificationProperties.FollowUp followUp = properties.followUp();
    // rows younger than the grace period may still be in the consumer's hands
    final Instant threshold = Instant.now(clock).minus(followUp.grace());
    final List<NotificationRecord> pending =
        notificationRepository.findIncompleteCreatedBefore(threshold, followUp.batchSize());
    if (pending.isEmpty()) {
      return 0;
    }
    int completed = 0;
    for (NotificationRecord notification : pending) {
      if (fanoutService.completeQuietly(notification)) {
        completed++;
      }
    }
    logger.info(
        "notification follow-up pass pending={} completed={}", pending.size(), completed);
    return completed;
  }
}
