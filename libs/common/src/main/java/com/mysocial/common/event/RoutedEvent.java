/*
 * Where: Shared event payloads
 * What: Envelope published by the outbox poller on every category topic
 * Why: Producer and consumers agree on one JSON shape, keyed by source_id for dedup
 */
package com.mysocial.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutedEvent(
    String topic,
    String eventType,
    JsonNode payload,
    String platformId,
    long sourceId,
    String eventId,
    String transactionId,
    String createdAt,
    String traceId) {

  /** Returns the text value of a top-level payload field, or null when absent or blank. */
  public String payloadText(String field) {
    if (payload == null || !payload.hasNonNull(field)) {
      return null;
    }
    final String value = payload.get(field).asText();
    return value == null || value.isBlank() ? null : value;
  }
}
