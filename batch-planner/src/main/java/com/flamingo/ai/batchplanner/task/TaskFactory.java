package com.flamingo.ai.batchplanner.task;

import com.flamingo.ai.batchplanner.model.Batch;
import java.time.Clock;

/** Creates pending tasks from planned batches. */
public final class TaskFactory {

  private TaskFactory() {}

  public static Task fromBatch(Batch batch) {
    return fromBatch(batch, Clock.systemUTC());
  }

  public static Task fromBatch(Batch batch, Clock clock) {
    return new Task("task_" + batch.id(), batch, clock);
  }
}
