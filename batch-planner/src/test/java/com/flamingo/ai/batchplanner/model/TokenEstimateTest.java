package com.flamingo.ai.batchplanner.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenEstimate Tests")
class TokenEstimateTest {

  @Test
  @DisplayName("should clamp negative totals to zero")
  void shouldClampNegativeTotal_whenCreated() {
    assertThat(TokenEstimate.of(-5).totalTokens()).isZero();
    assertThat(new TokenEstimate(-1, null, null).totalTokens()).isZero();
  }

  @Test
  @DisplayName("should fill default details when none are given")
  void shouldFillDefaultDetails_whenDetailsMissing() {
    TokenEstimate estimate = TokenEstimate.of(1000);

    assertThat(estimate.details().estimatedTokens()).isEqualTo(1000);
    assertThat(estimate.details().safeTokenCount()).isEqualTo(900);
    assertThat(estimate.details().confidence()).isEqualTo(0.8);
    assertThat(estimate.details().breakdown())
        .isEqualTo(new TokenEstimate.Breakdown(4000, 700, 200, 100));
    assertThat(estimate.hasError()).isFalse();
  }

  @Test
  @DisplayName("should cap the safe count at the total and clamp confidence")
  void shouldCapSafeCountAndClampConfidence_whenDetailsOutOfRange() {
    TokenEstimate estimate =
        TokenEstimate.of(1000, new TokenEstimate.Details(0, 5000, null, 1.7), null);

    assertThat(estimate.details().safeTokenCount()).isEqualTo(1000);
    assertThat(estimate.details().estimatedTokens()).isEqualTo(1000);
    assertThat(estimate.details().confidence()).isEqualTo(1.0);
    assertThat(estimate.safeTokenCount()).isEqualTo(1000);
  }

  @Test
  @DisplayName("should mark error estimates as unusable")
  void shouldReportError_whenBuiltFromError() {
    TokenEstimate estimate = TokenEstimate.error("src/broken.js", "tokenizer crashed");

    assertThat(estimate.hasError()).isTrue();
    assertThat(estimate.totalTokens()).isZero();
    assertThat(estimate.metadata().estimationMethod()).isEqualTo(TokenEstimate.METHOD_ERROR);
    assertThat(estimate.metadata().error()).isEqualTo("tokenizer crashed");
  }
}
