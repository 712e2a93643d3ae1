package com.mysocial.relay.crypto;

/** Ciphertext failed the GCM integrity check or cannot belong to the given conversation key. */
public class MessageAuthenticationException extends RuntimeException {

  public MessageAuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
