package com.mysocial.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PreferencesResponse(
    String userAddress,
    String emailAddress,
    boolean pushEnabled,
    boolean emailEnabled,
    List<String> mutedKinds,
    String updatedAt) {

  public PreferencesResponse {
    mutedKinds = mutedKinds == null ? List.of() : List.copyOf(mutedKinds);
  }
}
