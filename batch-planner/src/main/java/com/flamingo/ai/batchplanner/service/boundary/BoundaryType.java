package com.flamingo.ai.batchplanner.service.boundary;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of cut points, ordered by how safe it is to split a file there. */
public enum BoundaryType {
  CLASS("class", 10),
  INTERFACE("interface", 9),
  FUNCTION("function", 8),
  TYPE("type", 7),
  MODULE("module", 6),
  BLOCK("block", 5),
  COMMENT("comment", 4),
  BLANK("blank", 2);

  /** Boundaries at or above this priority count as structural. */
  public static final int STRUCTURAL_PRIORITY = COMMENT.priority;

  /** Boundaries at or above this priority count as high quality cut points. */
  public static final int HIGH_PRIORITY = TYPE.priority;

  private final String label;
  private final int priority;

  BoundaryType(String label, int priority) {
    this.label = label;
    this.priority = priority;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public int getPriority() {
    return priority;
  }
}
