package com.mysocial.relay.service.delivery;

import java.util.Locale;

/** Terminal result of one channel of a delivery job; the lower-case name is the metric tag. */
public enum ChannelOutcome {
  SENT,
  FAILED,
  DISABLED,
  NOT_CONFIGURED,
  MISCONFIGURED,
  NO_DESTINATION;

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
