package com.mysocial.relay.model;

import java.util.Map;

/**
 * Unread totals for one user. {@code platformUnread} is set when a platform was requested;
 * otherwise {@code platformCounts} carries every platform with a scoped counter.
 */
public record UnreadCounts(
    long totalUnread, String platformId, Long platformUnread, Map<String, Long> platformCounts) {

  public UnreadCounts {
    platformCounts = platformCounts == null ? Map.of() : Map.copyOf(platformCounts);
  }
}
