package com.flamingo.ai.batchplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Defines the kind of a batch and the strategy tag that must accompany it. */
public enum BatchKind {
  /** Several small files processed together. */
  COMBINED("combined_batch", "combined"),

  /** Exactly one medium-sized file. */
  SINGLE("single_batch", "single"),

  /** One contiguous line range of a large file. */
  CHUNK("large_file_chunk", "largeMulti");

  private final String typeName;
  private final String strategyTag;

  BatchKind(String typeName, String strategyTag) {
    this.typeName = typeName;
    this.strategyTag = strategyTag;
  }

  @JsonValue
  public String getTypeName() {
    return typeName;
  }

  public String getStrategyTag() {
    return strategyTag;
  }
}
