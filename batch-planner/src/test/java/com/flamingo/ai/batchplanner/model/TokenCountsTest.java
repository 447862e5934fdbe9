package com.flamingo.ai.batchplanner.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenCounts Tests")
class TokenCountsTest {

  @Test
  @DisplayName("should clamp plain numbers")
  void shouldClampNumbers() {
    assertThat(TokenCounts.extractTokenCount(500)).isEqualTo(500);
    assertThat(TokenCounts.extractTokenCount(-3)).isZero();
    assertThat(TokenCounts.extractTokenCount(12.7)).isEqualTo(12);
    assertThat(TokenCounts.extractTokenCount(Double.NaN)).isZero();
  }

  @Test
  @DisplayName("should read the total of an estimate, then its safe count")
  void shouldPreferTotal_thenSafeCount_whenReadingEstimate() {
    assertThat(TokenCounts.extractTokenCount(TokenEstimate.of(1200))).isEqualTo(1200);

    TokenEstimate zeroTotal =
        new TokenEstimate(0, new TokenEstimate.Details(400, 300, null, 0.5), null);
    assertThat(TokenCounts.extractTokenCount(zeroTotal)).isEqualTo(300);
  }

  @Test
  @DisplayName("should read the first positive value from a legacy map")
  void shouldReadFirstPositiveValue_whenGivenMap() {
    Map<String, Object> legacy = new HashMap<>();
    legacy.put("totalTokens", 0);
    legacy.put("safeTokenCount", 250);
    legacy.put("estimatedTokens", 400);

    assertThat(TokenCounts.extractTokenCount(legacy)).isEqualTo(250);
    assertThat(TokenCounts.extractTokenCount(Map.of("estimatedTokens", 100))).isEqualTo(100);
  }

  @Test
  @DisplayName("should return zero for unsupported shapes")
  void shouldReturnZero_whenShapeUnsupported() {
    assertThat(TokenCounts.extractTokenCount("1000")).isZero();
    assertThat(TokenCounts.extractTokenCount(null)).isZero();
    assertThat(TokenCounts.extractTokenCount(TokenEstimate.error("a.js", "failed"))).isZero();
  }

  @Test
  @DisplayName("should sum mixed shapes")
  void shouldSumMixedShapes() {
    int total =
        TokenCounts.sum(List.of(100, TokenEstimate.of(200), Map.of("totalTokens", 300), "x"));

    assertThat(total).isEqualTo(600);
  }

  @Test
  @DisplayName("should convert legacy maps into normalized estimates")
  void shouldConvertLegacyMap() {
    TokenEstimate estimate =
        TokenCounts.fromLegacy(Map.of("totalTokens", 1000, "confidence", 0.9));

    assertThat(estimate.totalTokens()).isEqualTo(1000);
    assertThat(estimate.details().safeTokenCount()).isEqualTo(900);
    assertThat(estimate.details().confidence()).isEqualTo(0.9);

    TokenEstimate failed =
        TokenCounts.fromLegacy(Map.of("error", "timeout", "filePath", "src/app.js"));
    assertThat(failed.hasError()).isTrue();
    assertThat(failed.metadata().filePath()).isEqualTo("src/app.js");
  }
}
