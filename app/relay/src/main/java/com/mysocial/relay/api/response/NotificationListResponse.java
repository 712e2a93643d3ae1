package com.mysocial.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationListResponse(
    String userAddress, List<NotificationResponse> notifications, int limit, int offset) {

  public NotificationListResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
