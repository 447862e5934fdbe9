package com.flamingo.ai.batchplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** How deeply the downstream generator should analyze a batch. */
public enum AnalysisDepth {
  BASIC("basic"),
  COMPREHENSIVE("comprehensive"),
  DETAILED("detailed");

  private final String value;

  AnalysisDepth(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
