/*
 * Where: Shared event payloads
 * What: Delivery job emitted for every newly created notification
 * Why: The dispatcher turns it into provider sends without reading the notification table
 */
package com.mysocial.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeliveryJob(
    String notificationId,
    String userAddress,
    String platformId,
    List<DeliveryChannel> channels,
    String kind,
    String title,
    String body,
    Map<String, String> data,
    String createdAt) {

  public DeliveryJob {
    channels = channels == null ? List.of() : List.copyOf(channels);
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  public boolean requests(DeliveryChannel channel) {
    return channels.contains(channel);
  }
}
