package com.mysocial.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageListResponse(
    String conversationId, List<MessageResponse> messages, int limit, int offset) {

  public MessageListResponse {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
