package com.mysocial.relay.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PageParametersTest {

  @Test
  void missingValuesUseDefaults() {
    assertThat(PageParameters.of(null, null)).isEqualTo(new PageParameters(50, 0));
  }

  @Test
  void limitAboveMaximumIsCapped() {
    assertThat(PageParameters.of(1_000, 20)).isEqualTo(new PageParameters(100, 20));
  }

  @Test
  void nonPositiveLimitIsRejected() {
    assertThatThrownBy(() -> PageParameters.of(0, 0))
        .isInstanceOf(InvalidRelayRequestException.class)
        .hasMessage("limit must be positive");
  }

  @Test
  void negativeOffsetIsRejected() {
    assertThatThrownBy(() -> PageParameters.of(10, -5))
        .isInstanceOf(InvalidRelayRequestException.class)
        .hasMessage("offset must not be negative");
  }
}
