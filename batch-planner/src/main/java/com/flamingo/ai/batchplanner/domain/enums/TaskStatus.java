package com.flamingo.ai.batchplanner.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

/** Defines the lifecycle status of a documentation task. */
public enum TaskStatus {
  /** Task has been created by the planner and is waiting for an executor. */
  PENDING("pending"),

  /** Task has been picked up by an executor. */
  IN_PROGRESS("in_progress"),

  /** Task finished and its output was written. */
  COMPLETED("completed"),

  /** Task ended with an error. */
  FAILED("failed"),

  /** Task was withdrawn before it finished. */
  CANCELLED("cancelled");

  private final String value;

  TaskStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  /** Returns the statuses this status may move to. */
  public Set<TaskStatus> allowedTransitions() {
    return switch (this) {
      case PENDING -> EnumSet.of(IN_PROGRESS, CANCELLED);
      case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
      case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
    };
  }

  public boolean canTransitionTo(TaskStatus next) {
    return allowedTransitions().contains(next);
  }
}
