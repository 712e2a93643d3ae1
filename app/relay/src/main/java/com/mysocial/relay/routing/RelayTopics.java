package com.mysocial.relay.routing;

/** Broker subjects shared by the poller, the consumers and the stream bootstrap. */
public final class RelayTopics {

  public static final String POST_REACTION = "events.post.reaction";
  public static final String POST_REPOST = "events.post.repost";
  public static final String POST_TIP = "events.post.tip";
  public static final String POST_CREATED = "events.post.created";
  public static final String POST_OWNERSHIP = "events.post.ownership";
  public static final String COMMENT_CREATED = "events.comment.created";
  public static final String SPT_CREATED = "events.spt.created";
  public static final String GOVERNANCE_CREATED = "events.governance.created";
  public static final String PREDICTION_CREATED = "events.prediction.created";
  public static final String FOLLOW_CREATED = "events.follow.created";
  public static final String UNFOLLOW_CREATED = "events.unfollow.created";
  public static final String PLATFORM_CREATED = "events.platform.created";
  public static final String MESSAGE_CREATED = "events.message.created";
  public static final String UNKNOWN = "events.unknown";

  private static final String EVENTS_PREFIX = "events.";

  private RelayTopics() {}

  /** Every event topic feeds the notification pipeline except messages and unroutable events. */
  public static boolean notifiesUsers(String topic) {
    return topic != null
        && topic.startsWith(EVENTS_PREFIX)
        && !MESSAGE_CREATED.equals(topic)
        && !UNKNOWN.equals(topic);
  }
}
