package com.mysocial.relay.model;

import java.time.Instant;
import java.util.Set;

public record UserPreferences(
    String userAddress,
    String emailAddress,
    boolean pushEnabled,
    boolean emailEnabled,
    Set<String> mutedKinds,
    Instant updatedAt) {

  public UserPreferences {
    mutedKinds = mutedKinds == null ? Set.of() : Set.copyOf(mutedKinds);
  }

  public static UserPreferences defaults(String userAddress) {
    return new UserPreferences(userAddress, null, true, true, Set.of(), null);
  }

  public boolean mutes(String kind) {
    return mutedKinds.contains(kind);
  }

  public boolean hasEmailAddress() {
    return emailAddress != null && !emailAddress.isBlank();
  }
}
