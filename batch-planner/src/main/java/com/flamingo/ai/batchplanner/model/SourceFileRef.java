package com.flamingo.ai.batchplanner.model;

import java.util.Objects;

/**
 * An analyzed source file handed to the planner.
 *
 * @param path path relative to the project root, unique within a planning run
 * @param tokenEstimate upstream token estimate
 * @param sizeBytes file size in bytes
 * @param language detected language, may be null
 * @param structuralSummary analyzer output, may be null
 */
public record SourceFileRef(
    String path,
    TokenEstimate tokenEstimate,
    long sizeBytes,
    String language,
    StructuralSummary structuralSummary) {

  public SourceFileRef {
    Objects.requireNonNull(path, "path");
    tokenEstimate = tokenEstimate == null ? TokenEstimate.of(0) : tokenEstimate;
  }

  /** Creates a reference carrying only a path and a token count. */
  public static SourceFileRef of(String path, int tokens) {
    return new SourceFileRef(path, TokenEstimate.of(tokens), 0, null, null);
  }

  public int tokenCount() {
    return TokenCounts.extractTokenCount(tokenEstimate);
  }

  public boolean hasEstimationError() {
    return tokenEstimate.hasError();
  }

  /** Returns the summary, or an empty one when the analyzer produced none. */
  public StructuralSummary summaryOrEmpty() {
    return structuralSummary != null ? structuralSummary : StructuralSummary.empty();
  }
}
