package com.flamingo.ai.batchplanner.model;

import java.time.Instant;

/**
 * Canonical token estimate for one file. {@code totalTokens} is the single number every planning
 * decision reads; details and metadata are informational.
 *
 * @param totalTokens estimated token count, never negative
 * @param details optional breakdown of the estimate
 * @param metadata optional provenance of the estimate
 */
public record TokenEstimate(int totalTokens, Details details, Metadata metadata) {

  public static final String METHOD_PRECISE = "precise_tiktoken";
  public static final String METHOD_ESTIMATED = "estimated";
  public static final String METHOD_BASIC = "basic";
  public static final String METHOD_CACHED = "cached";
  public static final String METHOD_ERROR = "error";
  public static final String METHOD_FALLBACK = "fallback";

  public static final double CONFIDENCE_HIGH = 0.9;
  public static final double CONFIDENCE_MEDIUM = 0.7;
  public static final double CONFIDENCE_LOW = 0.5;
  public static final double CONFIDENCE_VERY_LOW = 0.3;

  static final double DEFAULT_CONFIDENCE = 0.8;
  static final double SAFE_COUNT_RATIO = 0.9;

  public TokenEstimate {
    totalTokens = Math.max(0, totalTokens);
  }

  /** Creates an estimate with default details and no metadata. */
  public static TokenEstimate of(int totalTokens) {
    return of(totalTokens, null, null);
  }

  /**
   * Creates an estimate, clamping the total to zero and filling any detail the caller left out.
   *
   * @param totalTokens raw total, clamped to at least zero
   * @param details partial details or null
   * @param metadata metadata or null
   * @return the normalized estimate
   */
  public static TokenEstimate of(int totalTokens, Details details, Metadata metadata) {
    int total = Math.max(0, totalTokens);
    return new TokenEstimate(total, Details.withDefaults(total, details), metadata);
  }

  /** Creates the unusable estimate recorded when upstream estimation failed. */
  public static TokenEstimate error(String filePath, String message) {
    Metadata metadata = new Metadata(filePath, null, METHOD_ERROR, Instant.EPOCH, false, message);
    return new TokenEstimate(0, null, metadata);
  }

  public boolean hasError() {
    return metadata != null && metadata.error() != null;
  }

  /**
   * Token count with a safety margin applied.
   *
   * @return the detail value when present, otherwise 90% of the total
   */
  public int safeTokenCount() {
    if (details != null) {
      return details.safeTokenCount();
    }
    return (int) Math.floor(totalTokens * SAFE_COUNT_RATIO);
  }

  /**
   * @param estimatedTokens raw estimate before any safety margin
   * @param safeTokenCount estimate with a safety margin, never above the total
   * @param breakdown split of the tokens by content class
   * @param confidence confidence in the estimate, in [0, 1]
   */
  public record Details(
      int estimatedTokens, int safeTokenCount, Breakdown breakdown, double confidence) {

    public Details {
      estimatedTokens = Math.max(0, estimatedTokens);
      safeTokenCount = Math.max(0, safeTokenCount);
      confidence = clampConfidence(confidence);
    }

    static Details withDefaults(int total, Details raw) {
      if (raw == null) {
        return new Details(
            total, (int) Math.floor(total * SAFE_COUNT_RATIO), Breakdown.basic(total),
            DEFAULT_CONFIDENCE);
      }
      int estimated = raw.estimatedTokens() > 0 ? raw.estimatedTokens() : total;
      int safe =
          raw.safeTokenCount() > 0
              ? Math.min(raw.safeTokenCount(), total)
              : (int) Math.floor(total * SAFE_COUNT_RATIO);
      Breakdown breakdown = raw.breakdown() != null ? raw.breakdown() : Breakdown.basic(total);
      double confidence = raw.confidence() > 0 ? raw.confidence() : DEFAULT_CONFIDENCE;
      return new Details(estimated, safe, breakdown, confidence);
    }

    private static double clampConfidence(double value) {
      if (Double.isNaN(value)) {
        return DEFAULT_CONFIDENCE;
      }
      return Math.max(0.0, Math.min(1.0, value));
    }
  }

  /** Split of an estimate into code, comment and string tokens. */
  public record Breakdown(int totalChars, int codeTokens, int commentTokens, int stringTokens) {

    /** Assumes 4 characters per token and a 70/20/10 split between code, comments and strings. */
    public static Breakdown basic(int totalTokens) {
      return new Breakdown(
          totalTokens * 4,
          (int) Math.floor(totalTokens * 0.7),
          (int) Math.floor(totalTokens * 0.2),
          (int) Math.floor(totalTokens * 0.1));
    }
  }

  /**
   * @param filePath file the estimate belongs to
   * @param language detected language, may be null
   * @param estimationMethod one of the {@code METHOD_*} constants
   * @param timestamp when the estimate was produced
   * @param fromCache whether the estimate came from a cache
   * @param error failure message; when set the estimate must not be planned
   */
  public record Metadata(
      String filePath,
      String language,
      String estimationMethod,
      Instant timestamp,
      boolean fromCache,
      String error) {}
}
