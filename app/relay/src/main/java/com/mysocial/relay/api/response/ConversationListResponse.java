package com.mysocial.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConversationListResponse(
    List<ConversationResponse> conversations, int limit, int offset) {

  public ConversationListResponse {
    conversations = conversations == null ? List.of() : List.copyOf(conversations);
  }
}
