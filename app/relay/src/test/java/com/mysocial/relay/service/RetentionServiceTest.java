package com.mysocial.relay.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.mysocial.relay.config.RetentionProperties;
import com.mysocial.relay.repository.DeadLetterRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetentionServiceTest {

  @Mock private DeadLetterRepository deadLetterRepository;

  @Test
  void cleanupDeletesDeadLettersOlderThanRetention() {
    final Instant now = Instant.parse("2026-01-17T00:00:00Z");
    final RetentionService service =
        new RetentionService(
            deadLetterRepository,
            new RetentionProperties(true, 14, Duration.ofHours(1)),
            Clock.fixed(now, ZoneOffset.UTC));
    when(deadLetterRepository.deleteOlderThan(Instant.parse("2026-01-03T00:00:00Z")))
        .thenReturn(7);

    assertThat(service.cleanup()).isEqualTo(7);
  }
}
