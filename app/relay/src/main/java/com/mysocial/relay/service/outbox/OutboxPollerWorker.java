package com.mysocial.relay.service.outbox;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "relay.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class OutboxPollerWorker {

  private final OutboxPoller poller;

  @Scheduled(fixedDelayString = "${relay.outbox.poll-interval}")
  public void run() {
    poller.poll();
  }

  @PreDestroy
  public void stop() {
    poller.releaseLease();
  }
}
