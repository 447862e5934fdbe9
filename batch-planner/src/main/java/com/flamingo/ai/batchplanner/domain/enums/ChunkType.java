package com.flamingo.ai.batchplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Dominant structure of a chunk cut from a large file. */
public enum ChunkType {
  CLASS_FOCUSED("class-focused"),
  INTERFACE_FOCUSED("interface-focused"),
  FUNCTION_FOCUSED("function-focused"),
  MODULE_FOCUSED("module-focused"),

  /** No structural boundary dominates, or the cut was forced at the size limit. */
  MIXED("mixed"),

  /** Trailing chunk with no structural boundary of its own. */
  REMAINDER("remainder"),

  /** Produced by equal line-count splitting after boundary detection was unavailable. */
  FALLBACK("fallback");

  private final String label;

  ChunkType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
