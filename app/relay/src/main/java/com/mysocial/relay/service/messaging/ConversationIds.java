package com.mysocial.relay.service.messaging;

/** Conversation ids are the two participant addresses, lower one first, joined by a colon. */
public final class ConversationIds {

  private static final String SEPARATOR = ":";

  private ConversationIds() {}

  public static String canonical(String first, String second) {
    if (first == null || first.isBlank() || second == null || second.isBlank()) {
      throw new IllegalArgumentException("both participants are required");
    }
    return first.compareTo(second) <= 0 ? first + SEPARATOR + second : second + SEPARATOR + first;
  }

  public static String lowerParticipant(String first, String second) {
    return first.compareTo(second) <= 0 ? first : second;
  }

  public static String higherParticipant(String first, String second) {
    return first.compareTo(second) <= 0 ? second : first;
  }
}
