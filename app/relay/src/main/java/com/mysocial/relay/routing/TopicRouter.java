/*
 * Where: Relay routing
 * What: Maps an outbox event type to its category topic
 * Why: Consumers subscribe per category; unmatched types still flow to events.unknown
 */
package com.mysocial.relay.routing;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deterministic event-type router. An exact rule beats every prefix rule; among prefix rules the
 * longest matching prefix wins. Types matching nothing route to {@link RelayTopics#UNKNOWN}.
 */
@Component
public class TopicRouter {

  private static final Logger logger = LoggerFactory.getLogger(TopicRouter.class);

  private final Map<String, String> exactRules;
  private final List<Map.Entry<String, String>> prefixRules;

  public TopicRouter() {
    this(defaultExactRules(), defaultPrefixRules());
  }

  public TopicRouter(Map<String, String> exactRules, Map<String, String> prefixRules) {
    this.exactRules = Map.copyOf(exactRules);
    // longest prefix first, ties broken alphabetically so iteration order never matters
    this.prefixRules =
        prefixRules.entrySet().stream()
            .map(entry -> Map.entry(entry.getKey(), entry.getValue()))
            .sorted(
                Comparator.comparingInt(
                        (Map.Entry<String, String> entry) -> entry.getKey().length())
                    .reversed()
                    .thenComparing(Map.Entry::getKey))
            .toList();
  }

  public String route(String eventType) {
    if (eventType == null || eventType.isBlank()) {
      logger.warn("outbox event without event type routed to {}", RelayTopics.UNKNOWN);
      return RelayTopics.UNKNOWN;
    }
    final String exact = exactRules.get(eventType);
    if (exact != null) {
      return exact;
    }
    for (Map.Entry<String, String> rule : prefixRules) {
      if (eventType.startsWith(rule.getKey())) {
        return rule.getValue();
      }
    }
    logger.warn("unrouted event type eventType={} topic={}", eventType, RelayTopics.UNKNOWN);
    return RelayTopics.UNKNOWN;
  }

  static Map<String, String> defaultExactRules() {
    final Map<String, String> rules = new LinkedHashMap<>();
    rules.put("post.created", RelayTopics.POST_CREATED);
    rules.put("ownership.transferred", RelayTopics.POST_OWNERSHIP);
    return rules;
  }

  static Map<String, String> defaultPrefixRules() {
    final Map<String, String> rules = new LinkedHashMap<>();
    rules.put("reaction.", RelayTopics.POST_REACTION);
    rules.put("like.", RelayTopics.POST_REACTION);
    rules.put("repost.", RelayTopics.POST_REPOST);
    rules.put("tip.", RelayTopics.POST_TIP);
    rules.put("post.ownership.", RelayTopics.POST_OWNERSHIP);
    rules.put("comment.", RelayTopics.COMMENT_CREATED);
    rules.put("spt.", RelayTopics.SPT_CREATED);
    rules.put("governance.", RelayTopics.GOVERNANCE_CREATED);
    rules.put("proposal.", RelayTopics.GOVERNANCE_CREATED);
    rules.put("prediction.", RelayTopics.PREDICTION_CREATED);
    rules.put("follow.", RelayTopics.FOLLOW_CREATED);
    rules.put("unfollow.", RelayTopics.UNFOLLOW_CREATED);
    rules.put("platform.", RelayTopics.PLATFORM_CREATED);
    rules.put("message.", RelayTopics.MESSAGE_CREATED);
    return rules;
  }
}
