/*
 * Where: Relay API
 * What: Caller is not a participant of the requested conversation
 * Why: Rejected with 403 before any ciphertext is decrypted
 */
package com.mysocial.relay.api;

public class ConversationAccessDeniedException extends RuntimeException {
  public ConversationAccessDeniedException(String conversationId) {
    super("caller is not a participant of conversation: " + conversationId);
  }
}
