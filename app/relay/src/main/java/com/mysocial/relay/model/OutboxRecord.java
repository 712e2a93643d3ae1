package com.mysocial.relay.model;

import java.time.Instant;

public record OutboxRecord(
    long id,
    String eventType,
    String payloadJson,
    String eventId,
    String transactionId,
    String platformId,
    Instant createdAt,
    int retryCount,
    Instant nextRetryAt) {

  public boolean isDueAt(Instant now) {
    return nextRetryAt == null || !nextRetryAt.isAfter(now);
  }
}
