package com.flamingo.ai.batchplanner.model;

import java.util.Collection;
import java.util.Map;

/**
 * Normalizes loosely shaped token data into a single integer. This is the only place where
 * legacy shapes (plain numbers, partial maps) are interpreted.
 */
public final class TokenCounts {

  private TokenCounts() {}

  /**
   * Extracts a token count from any supported shape.
   *
   * <p>Numbers are clamped to zero. Estimates use their total, falling back to the safe count and
   * then the raw estimate when the total is zero. Maps are read the same way by key. Anything else
   * yields zero.
   */
  public static int extractTokenCount(Object tokenData) {
    if (tokenData == null) {
      return 0;
    }
    if (tokenData instanceof Number number) {
      return clamp(number);
    }
    if (tokenData instanceof TokenEstimate estimate) {
      if (estimate.hasError()) {
        return 0;
      }
      if (estimate.totalTokens() > 0 || estimate.details() == null) {
        return estimate.totalTokens();
      }
      return fromDetails(estimate.details());
    }
    if (tokenData instanceof TokenEstimate.Details details) {
      return fromDetails(details);
    }
    if (tokenData instanceof Map<?, ?> map) {
      return firstPositive(
          map.get("totalTokens"), map.get("safeTokenCount"), map.get("estimatedTokens"));
    }
    return 0;
  }

  /** Sums the token counts of every element, each read with {@link #extractTokenCount}. */
  public static int sum(Collection<?> tokenData) {
    long total = 0;
    for (Object item : tokenData) {
      total += extractTokenCount(item);
    }
    return (int) Math.min(Integer.MAX_VALUE, total);
  }

  /**
   * Converts a legacy map (keys {@code totalTokens}, {@code safeTokenCount},
   * {@code estimatedTokens}, {@code confidence}, {@code error}) into a normalized estimate.
   */
  public static TokenEstimate fromLegacy(Map<String, ?> legacy) {
    if (legacy == null) {
      return TokenEstimate.of(0);
    }
    Object error = legacy.get("error");
    if (error != null) {
      Object path = legacy.get("filePath");
      return TokenEstimate.error(path != null ? path.toString() : null, error.toString());
    }
    int total = extractTokenCount(legacy);
    TokenEstimate.Details details =
        new TokenEstimate.Details(
            extractTokenCount(legacy.get("estimatedTokens")),
            extractTokenCount(legacy.get("safeTokenCount")),
            null,
            legacy.get("confidence") instanceof Number confidence ? confidence.doubleValue() : 0);
    return TokenEstimate.of(total, details, null);
  }

  private static int fromDetails(TokenEstimate.Details details) {
    if (details.safeTokenCount() > 0) {
      return details.safeTokenCount();
    }
    return details.estimatedTokens();
  }

  private static int firstPositive(Object... candidates) {
    for (Object candidate : candidates) {
      if (candidate instanceof Number number) {
        int value = clamp(number);
        if (value > 0) {
          return value;
        }
      }
    }
    return 0;
  }

  private static int clamp(Number number) {
    double value = number.doubleValue();
    if (Double.isNaN(value) || value <= 0) {
      return 0;
    }
    return (int) Math.min(Integer.MAX_VALUE, Math.floor(value));
  }
}
