/*
 * Where: Relay API
 * What: Request that fails validation beyond bean constraints
 * Why: Normalized to a 400 response
 */
package com.mysocial.relay.api;

public class InvalidRelayRequestException extends RuntimeException {
  public InvalidRelayRequestException(String message) {
    super(message);
  }
}
