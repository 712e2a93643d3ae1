/*
 * Where: Relay notification pipeline
 * What: Extracts recipients and the acting user from a routed event payload
 * Why: Each event family names its recipient in a different payload field
 */
package com.mysocial.relay.service.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.mysocial.common.event.RoutedEvent;
import com.mysocial.relay.routing.RelayTopics;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RecipientResolver {

  private static final Logger logger = LoggerFactory.getLogger(RecipientResolver.class);

  /** Actor fields checked when a family does not name its own. */
  private static final List<String> COMMON_ACTOR_FIELDS =
      List.of("actor_address", "sender_address", "user_address", "author_address");

  private static final Map<String, Rule> RULES =
      Map.ofEntries(
          Map.entry(
              RelayTopics.POST_REACTION,
              new Rule("reaction", List.of("post_owner"), List.of("reactor_address"))),
          Map.entry(
              RelayTopics.POST_REPOST,
              new Rule("repost", List.of("post_owner"), List.of("reposter_address"))),
          Map.entry(
              RelayTopics.POST_TIP,
              new Rule(
                  "tip", List.of("recipient_address", "post_owner"), List.of("tipper_address"))),
          Map.entry(
              RelayTopics.POST_CREATED,
              new Rule("mention", List.of("mentions", "mentioned_addresses"), List.of("owner"))),
          Map.entry(
              RelayTopics.POST_OWNERSHIP,
              new Rule("ownership", List.of("new_owner"), List.of("previous_owner"))),
          Map.entry(
              RelayTopics.COMMENT_CREATED,
              new Rule(
                  "comment",
                  List.of("post_owner", "parent_comment_owner"),
                  List.of("commenter_address"))),
          Map.entry(
              RelayTopics.SPT_CREATED,
              new Rule("spt", List.of("post_owner", "target_address"), List.of("creator"))),
          Map.entry(
              RelayTopics.GOVERNANCE_CREATED,
              new Rule("governance", List.of("target_address"), List.of("proposer"))),
          Map.entry(
              RelayTopics.PREDICTION_CREATED,
              new Rule("prediction", List.of("post_owner", "target_address"), List.of("creator"))),
          Map.entry(
              RelayTopics.FOLLOW_CREATED,
              new Rule("follow", List.of("following_address"), List.of("follower_address"))),
          Map.entry(
              RelayTopics.PLATFORM_CREATED,
              new Rule("platform", List.of("target_address"), List.of("developer"))));

  public RecipientResolution resolve(RoutedEvent event) {
    final Rule rule = RULES.get(event.topic());
    if (rule == null) {
      logger.debug("no notification rule topic={} eventType={}", event.topic(), event.eventType());
      return RecipientResolution.none();
    }
    final String actor = actorOf(event, rule);
    final Set<String> recipients = new LinkedHashSet<>();
    for (String field : rule.recipientFields()) {
      collectAddresses(event.payload(), field, recipients);
    }
    if (actor != null) {
      // nobody is notified about their own action
      recipients.remove(actor);
    }
    return new RecipientResolution(rule.kind(), actor, new ArrayList<>(recipients));
  }

  private static String actorOf(RoutedEvent event, Rule rule) {
    for (String field : rule.actorFields()) {
      final String value = event.payloadText(field);
      if (value != null) {
        return value;
      }
    }
    for (String field : COMMON_ACTOR_FIELDS) {
      final String value = event.payloadText(field);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private static void collectAddresses(JsonNode payload, String field, Set<String> target) {
    if (payload == null || !payload.hasNonNull(field)) {
      return;
    }
    final JsonNode node = payload.get(field);
    if (node.isArray()) {
      for (JsonNode element : node) {
        addIfPresent(element, target);
      }
      return;
    }
    addIfPresent(node, target);
  }

  private static void addIfPresent(JsonNode node, Set<String> target) {
    if (node == null || !node.isTextual()) {
      return;
    }
    final String value = node.asText().trim();
    if (!value.isEmpty()) {
      target.add(value);
    }
  }

  private record Rule(String kind, List<String> recipientFields, List<String> actorFields) {}
}
