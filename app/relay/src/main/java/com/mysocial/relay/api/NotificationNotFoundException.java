package com.mysocial.relay.api;

public class NotificationNotFoundException extends RuntimeException {
  public NotificationNotFoundException(String notificationId) {
    super("notification not found: " + notificationId);
  }
}
