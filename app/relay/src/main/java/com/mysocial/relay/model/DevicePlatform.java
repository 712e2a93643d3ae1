package com.mysocial.relay.model;

import java.util.Locale;

public enum DevicePlatform {
  IOS("ios"),
  ANDROID("android");

  private final String wireName;

  DevicePlatform(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static DevicePlatform fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("device platform is required");
    }
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "ios" -> IOS;
      case "android" -> ANDROID;
      default -> throw new IllegalArgumentException("unsupported device platform: " + value);
    };
  }
}
