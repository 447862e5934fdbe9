package com.flamingo.ai.batchplanner.task;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Timestamps of a task's lifecycle.
 *
 * @param createdAt when the task was created
 * @param startedAt when the task entered {@code IN_PROGRESS}, null before that
 * @param completedAt when the task reached a terminal status, null before that
 */
public record TaskTiming(Instant createdAt, Instant startedAt, Instant completedAt) {

  public static TaskTiming createdAt(Instant createdAt) {
    return new TaskTiming(createdAt, null, null);
  }

  TaskTiming started(Instant at) {
    return new TaskTiming(createdAt, at, completedAt);
  }

  TaskTiming completed(Instant at) {
    return new TaskTiming(createdAt, startedAt, at);
  }

  /** Time between start and completion, present once both happened. */
  public Optional<Duration> actualDuration() {
    if (startedAt == null || completedAt == null) {
      return Optional.empty();
    }
    return Optional.of(Duration.between(startedAt, completedAt));
  }
}
