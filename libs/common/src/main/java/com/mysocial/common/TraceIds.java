package com.mysocial.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String orNew(String candidate) {
    return candidate == null || candidate.isBlank() ? newTraceId() : candidate;
  }
}
