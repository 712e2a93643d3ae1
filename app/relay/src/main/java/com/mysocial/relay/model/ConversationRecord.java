package com.mysocial.relay.model;

import java.time.Instant;

public record ConversationRecord(
    String id,
    String participantA,
    String participantB,
    Instant createdAt,
    Instant lastMessageAt) {

  public boolean hasParticipant(String userAddress) {
    return participantA.equals(userAddress) || participantB.equals(userAddress);
  }

  public String otherParticipant(String userAddress) {
    return participantA.equals(userAddress) ? participantB : participantA;
  }
}
