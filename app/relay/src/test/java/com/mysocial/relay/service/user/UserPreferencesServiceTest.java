package com.mysocial.relay.service.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mysocial.relay.api.request.UpdatePreferencesRequest;
import com.mysocial.relay.api.response.PreferencesResponse;
import com.mysocial.relay.model.UserPreferences;
import com.mysocial.relay.repository.UserPreferencesRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserPreferencesServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private UserPreferencesRepository preferencesRepository;

  private UserPreferencesService service;

  @BeforeEach
  void setUp() {
    service = new UserPreferencesService(preferencesRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void userWithoutRowGetsDefaults() {
    when(preferencesRepository.findByUser("0xbob")).thenReturn(Optional.empty());

    final PreferencesResponse response = service.getPreferences("0xbob");

    assertThat(response.pushEnabled()).isTrue();
    assertThat(response.emailEnabled()).isTrue();
    assertThat(response.mutedKinds()).isEmpty();
    assertThat(response.updatedAt()).isNull();
  }

  @Test
  void partialUpdateKeepsUnsetFields() {
    when(preferencesRepository.findByUser("0xbob"))
        .thenReturn(
            Optional.of(
                new UserPreferences(
                    "0xbob", "bob@mail.xyz", true, true, Set.of("tip"), NOW.minusSeconds(60))));

    final PreferencesResponse response =
        service.updatePreferences(
            "0xbob",
            new UpdatePreferencesRequest(null, false, null, Arrays.asList(" Reaction ", "", null)));

    final ArgumentCaptor<UserPreferences> saved = ArgumentCaptor.forClass(UserPreferences.class);
    verify(preferencesRepository).upsert(saved.capture());
    assertThat(saved.getValue().emailAddress()).isEqualTo("bob@mail.xyz");
    assertThat(saved.getValue().pushEnabled()).isFalse();
    assertThat(saved.getValue().emailEnabled()).isTrue();
    assertThat(saved.getValue().mutedKinds()).containsExactly("reaction");
    assertThat(response.updatedAt()).isEqualTo(NOW.toString());
  }

  @Test
  void blankEmailClearsAddress() {
    when(preferencesRepository.findByUser("0xbob"))
        .thenReturn(
            Optional.of(new UserPreferences("0xbob", "bob@mail.xyz", true, true, Set.of(), NOW)));

    final PreferencesResponse response =
        service.updatePreferences("0xbob", new UpdatePreferencesRequest("", null, null, null));

    assertThat(response.emailAddress()).isNull();
    assertThat(response.mutedKinds()).isEmpty();
  }
}
