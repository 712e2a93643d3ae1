package com.mysocial.relay.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResponse(
    String id,
    long sourceId,
    String platformId,
    String kind,
    String title,
    String body,
    JsonNode payload,
    String createdAt,
    String readAt,
    boolean read) {}
