package com.mysocial.relay.api;

/** Caller identity taken from the header the authenticating gateway sets. */
public final class CallerAddress {

  public static final String HEADER = "X-User-Address";

  private CallerAddress() {}

  public static String require(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      throw new InvalidRelayRequestException(HEADER + " must not be blank");
    }
    return headerValue.strip();
  }
}
