package com.mysocial.relay.service.notification;

import java.util.List;

/** Notification kind for an event plus the users that should receive it, actor already removed. */
public record RecipientResolution(String kind, String actorAddress, List<String> recipients) {

  public RecipientResolution {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
  }

  public static RecipientResolution none() {
    return new RecipientResolution(null, null, List.of());
  }

  public boolean isEmpty() {
    return recipients.isEmpty();
  }
}
