package com.mysocial.relay.api;

public class ConversationNotFoundException extends RuntimeException {
  public ConversationNotFoundException(String conversationId) {
    super("conversation not found: " + conversationId);
  }
}
