package com.mysocial.relay.model;

import java.util.Locale;

/** JetStream consumers hosted by the relay; the lower-case name tags dead letters and metrics. */
public enum ConsumerPipeline {
  NOTIFICATION,
  MESSAGING,
  DELIVERY;

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
