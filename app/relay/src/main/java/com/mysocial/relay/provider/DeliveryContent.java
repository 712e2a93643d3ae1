package com.mysocial.relay.provider;

import java.util.Map;

/** What a provider shows to the user; independent of the provider wire format. */
public record DeliveryContent(String title, String body, String kind, Map<String, String> data) {

  public DeliveryContent {
    data = data == null ? Map.of() : Map.copyOf(data);
  }
}
