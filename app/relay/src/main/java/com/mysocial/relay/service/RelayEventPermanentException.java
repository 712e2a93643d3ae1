/*
 * Where: Relay service layer
 * What: Event processing failure that redelivery cannot fix
 * Why: Consumers dead-letter and TERM these instead of naking
 */
package com.mysocial.relay.service;

public class RelayEventPermanentException extends RuntimeException {

  public RelayEventPermanentException(String message) {
    super(message);
  }

  public RelayEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
