/*
 * Where: Relay notification pipeline
 * What: Builds the title and body shown in the inbox and in push/email deliveries
 */
package com.mysocial.relay.service.notification;

import com.mysocial.common.event.RoutedEvent;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class NotificationFormatter {

  private static final FormattedNotification FALLBACK =
      new FormattedNotification("Notification", "You have a new notification");

  private static final Map<String, FormattedNotification> TEMPLATES =
      Map.ofEntries(
          Map.entry(
              "reaction",
              new FormattedNotification("New Reaction", "Someone reacted to your post")),
          Map.entry(
              "repost",
              new FormattedNotification("New Repost", "Someone reposted your post")),
          Map.entry("tip", new FormattedNotification("New Tip", "Someone tipped your post")),
          Map.entry(
              "mention",
              new FormattedNotification("New Mention", "Someone mentioned you in a post")),
          Map.entry(
              "ownership",
              new FormattedNotification("Post Ownership", "A post was transferred to you")),
          Map.entry(
              "comment",
              new FormattedNotification("New Comment", "Someone commented on your post")),
          Map.entry(
              "spt",
              new FormattedNotification("New SPT", "A social proof token was created")),
          Map.entry(
              "governance",
              new FormattedNotification("Governance", "A new governance proposal needs you")),
          Map.entry(
              "prediction",
              new FormattedNotification("New Prediction", "A prediction was created on your post")),
          Map.entry(
              "follow", new FormattedNotification("New Follower", "Someone started following you")),
          Map.entry("platform", new FormattedNotification("Platform", "A platform was created")));

  public FormattedNotification format(String kind, RoutedEvent event) {
    final FormattedNotification template = TEMPLATES.getOrDefault(kind, FALLBACK);
    if ("tip".equals(kind)) {
      final String amount = event.payloadText("amount");
      if (amount != null) {
        return new FormattedNotification(
            template.title(), "Someone tipped your post " + amount);
      }
    }
    return template;
  }
}
