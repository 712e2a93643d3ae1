/*
 * Where: Relay user settings
 * What: Reads and updates per-user delivery preferences and muted notification kinds
 * Why: Users without a row get defaults (push and email on, nothing muted)
 */
package com.mysocial.relay.service.user;

import com.mysocial.relay.api.request.UpdatePreferencesRequest;
import com.mysocial.relay.api.response.PreferencesResponse;
import com.mysocial.relay.model.UserPreferences;
import com.mysocial.relay.repository.UserPreferencesRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserPreferencesService {

  private static final Logger logger = LoggerFactory.getLogger(UserPreferencesService.class);

  private final UserPreferencesRepository preferencesRepository;
  private final Clock clock;

  public UserPreferences find(String userAddress) {
    return preferencesRepository
        .findByUser(userAddress)
        .orElseGet(() -> UserPreferences.defaults(userAddress));
  }

  public PreferencesResponse getPreferences(String userAddress) {
    return toResponse(find(userAddress));
  }

  public PreferencesResponse updatePreferences(
      String userAddress, UpdatePreferencesRequest request) {
    final UserPreferences current = find(userAddress);
    final UserPreferences updated =
        new UserPreferences(
            userAddress,
            request.emailAddress() != null
                ? blankToNull(request.emailAddress())
                : current.emailAddress(),
            request.pushEnabled() != null ? request.pushEnabled() : current.pushEnabled(),
            request.emailEnabled() != null ? request.emailEnabled() : current.emailEnabled(),
            request.mutedKinds() != null ? normalizeKinds(request) : current.mutedKinds(),
            Instant.now(clock));
    preferencesRepository.upsert(updated);
    logger.info(
        "preferences updated user={} pushEnabled={} emailEnabled={} mutedKinds={}",
        userAddress,
        updated.pushEnabled(),
        updated.emailEnabled(),
        updated.mutedKinds().size());
    return toResponse(updated);
  }

  private static Set<String> normalizeKinds(UpdatePreferencesRequest request) {
    final Set<String> kinds = new LinkedHashSet<>();
    for (String kind : request.mutedKinds()) {
      if (kind != null && !kind.isBlank()) {
        kinds.add(kind.trim().toLowerCase(Locale.ROOT));
      }
    }
    return kinds;
  }

  private static PreferencesResponse toResponse(UserPreferences preferences) {
    return new PreferencesResponse(
        preferences.userAddress(),
        preferences.emailAddress(),
        preferences.pushEnabled(),
        preferences.emailEnabled(),
        preferences.mutedKinds().stream().sorted().toList(),
        preferences.updatedAt() == null ? null : preferences.updatedAt().toString());
  }

  private static String blankToNull(String value) {
    return value.isBlank() ? null : value.trim();
  }
}
