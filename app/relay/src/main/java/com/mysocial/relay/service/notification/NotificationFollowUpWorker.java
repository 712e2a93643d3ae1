package com.mysocial.relay.service.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "relay.notification.follow-up.enabled",
    havingValue = "true",
    matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NotificationFollowUpWorker {

  private final NotificationFollowUpService followUpService;

  @Scheduled(fixedDelayString = "${relay.notification.follow-up.interval}")
  public void run() {
    followUpService.completePending();
  }
}
