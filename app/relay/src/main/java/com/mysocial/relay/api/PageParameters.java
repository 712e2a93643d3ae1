/*
 * Where: Relay API
 * What: limit/offset query parameters shared by the list endpoints
 */
package com.mysocial.relay.api;

public record PageParameters(int limit, int offset) {

  public static final int DEFAULT_LIMIT = 50;
  public static final int MAX_LIMIT = 100;

  /** Missing values take defaults; a limit above the maximum is capped. */
  public static PageParameters of(Integer limit, Integer offset) {
    final int resolvedLimit = limit == null ? DEFAULT_LIMIT : limit;
    final int resolvedOffset = offset == null ? 0 : offset;
    if (resolvedLimit < 1) {
      throw new InvalidRelayRequestException("limit must be positive");
    }
    if (resolvedOffset < 0) {
      throw new InvalidRelayRequestException("offset must not be negative");
    }
    return new PageParameters(Math.min(resolvedLimit, MAX_LIMIT), resolvedOffset);
  }
}
