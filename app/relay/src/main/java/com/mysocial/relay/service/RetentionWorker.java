package com.mysocial.relay.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "relay.retention.enabled", havingValue = "true")
public class RetentionWorker {

  private final RetentionService retentionService;

  @Scheduled(fixedDelayString = "${relay.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
