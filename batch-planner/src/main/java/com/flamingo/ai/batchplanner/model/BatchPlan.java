package com.flamingo.ai.batchplanner.model;

import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import com.flamingo.ai.batchplanner.task.Task;
import com.flamingo.ai.batchplanner.task.TaskFactory;
import java.time.Clock;
import java.util.List;

/**
 * Result of a planning run.
 *
 * @param batches combined, then single, then chunk batches
 * @param rejections files that were not planned, with reasons
 * @param stats summary counts
 */
public record BatchPlan(List<Batch> batches, List<RejectedFile> rejections, PlanStats stats) {

  public BatchPlan {
    batches = batches == null ? List.of() : List.copyOf(batches);
    rejections = rejections == null ? List.of() : List.copyOf(rejections);
  }

  public List<Batch> batchesOf(BatchKind kind) {
    return batches.stream().filter(batch -> batch.kind() == kind).toList();
  }

  /** Wraps every batch as a pending task, in plan order. */
  public List<Task> toTasks() {
    return toTasks(Clock.systemUTC());
  }

  public List<Task> toTasks(Clock clock) {
    return batches.stream().map(batch -> TaskFactory.fromBatch(batch, clock)).toList();
  }
}
