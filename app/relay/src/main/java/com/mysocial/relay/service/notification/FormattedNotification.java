package com.mysocial.relay.service.notification;

public record FormattedNotification(String title, String body) {}
