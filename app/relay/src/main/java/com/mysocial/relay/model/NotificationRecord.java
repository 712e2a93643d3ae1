package com.mysocial.relay.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID id,
    long sourceId,
    String userAddress,
    String platformId,
    String kind,
    String title,
    String body,
    String payloadJson,
    Instant createdAt,
    Instant readAt,
    Instant countersAppliedAt,
    Instant deliveryEmittedAt) {

  public boolean isRead() {
    return readAt != null;
  }

  public boolean countersApplied() {
    return countersAppliedAt != null;
  }

  public boolean deliveryEmitted() {
    return deliveryEmittedAt != null;
  }
}
