package com.mysocial.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConversationResponse(
    String conversationId, String otherParticipant, String createdAt, String lastMessageAt) {}
