package com.mysocial.relay.crypto;

import javax.crypto.SecretKey;

/**
 * AES key derived for exactly one conversation. Instances are created per encrypt/decrypt call and
 * never persisted.
 */
public final class ConversationKey {

  private final String conversationId;
  private final SecretKey secretKey;

  ConversationKey(String conversationId, SecretKey secretKey) {
    this.conversationId = conversationId;
    this.secretKey = secretKey;
  }

  public String conversationId() {
    return conversationId;
  }

  SecretKey secretKey() {
    return secretKey;
  }

  @Override
  public String toString() {
    return "ConversationKey[conversationId=" + conversationId + "]";
  }
}
