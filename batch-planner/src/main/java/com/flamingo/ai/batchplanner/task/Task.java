package com.flamingo.ai.batchplanner.task;

import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import com.flamingo.ai.batchplanner.domain.enums.TaskStatus;
import com.flamingo.ai.batchplanner.model.Batch;
import com.flamingo.ai.batchplanner.model.ChunkInfo;
import com.flamingo.ai.batchplanner.model.ProcessingHints;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import lombok.Getter;

/**
 * A batch wrapped for execution. The planner only creates pending tasks; executors move them
 * through the lifecycle with the transition methods, which reject illegal moves.
 */
@Getter
public class Task {

  private static final long BASE_MILLIS = 30_000;
  private static final long MILLIS_PER_THOUSAND_TOKENS = 2_000;
  private static final long MILLIS_PER_EXTRA_FILE = 5_000;

  private final String id;
  private final Batch batch;
  private final ProcessingHints processingHints;
  private final Clock clock;
  private TaskStatus status;
  private TaskTiming timing;
  private String failureReason;

  Task(String id, Batch batch, Clock clock) {
    this.id = id;
    this.batch = batch;
    this.processingHints = batch.metadata() != null ? batch.metadata().processingHints() : null;
    this.clock = clock;
    this.status = TaskStatus.PENDING;
    this.timing = TaskTiming.createdAt(clock.instant());
  }

  public synchronized TaskStatus getStatus() {
    return status;
  }

  public synchronized TaskTiming getTiming() {
    return timing;
  }

  public synchronized String getFailureReason() {
    return failureReason;
  }

  public synchronized void start() {
    transitionTo(TaskStatus.IN_PROGRESS);
    timing = timing.started(clock.instant());
  }

  public synchronized void complete() {
    transitionTo(TaskStatus.COMPLETED);
    timing = timing.completed(clock.instant());
  }

  public synchronized void fail(String reason) {
    transitionTo(TaskStatus.FAILED);
    failureReason = reason;
    timing = timing.completed(clock.instant());
  }

  public synchronized void cancel() {
    transitionTo(TaskStatus.CANCELLED);
    timing = timing.completed(clock.instant());
  }

  /** Rough execution time: 30 s, plus 2 s per 1,000 tokens, plus 5 s per member beyond one. */
  public Duration estimatedDuration() {
    long tokenMillis = Math.round(batch.estimatedTokens() / 1000.0 * MILLIS_PER_THOUSAND_TOKENS);
    long extraFiles = Math.max(0, batch.memberCount() - 1);
    return Duration.ofMillis(BASE_MILLIS + tokenMillis + extraFiles * MILLIS_PER_EXTRA_FILE);
  }

  /** Returns {@code chunk i/n} for chunk batches. */
  public Optional<String> chunkProgressDescription() {
    ChunkInfo chunk = batch.chunkInfo();
    if (chunk == null) {
      return Optional.empty();
    }
    return Optional.of("chunk " + chunk.chunkIndex() + "/" + chunk.totalChunks());
  }

  public synchronized String progressDescription() {
    String subject = subject();
    return switch (status) {
      case PENDING -> "Waiting to process " + subject;
      case IN_PROGRESS -> "Processing " + subject;
      case COMPLETED -> "Completed " + subject;
      case FAILED ->
          "Failed " + subject + (failureReason != null ? ": " + failureReason : "");
      case CANCELLED -> "Cancelled " + subject;
    };
  }

  private String subject() {
    if (batch.kind() == BatchKind.COMBINED) {
      return "combined batch of " + batch.memberCount() + " files";
    }
    String name = fileName(batch.primaryPath());
    return chunkProgressDescription().map(chunk -> chunk + " of " + name).orElse(name);
  }

  private void transitionTo(TaskStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Task " + id + " cannot move from " + status + " to " + next);
    }
    status = next;
  }

  private static String fileName(String path) {
    if (path == null) {
      return "unknown file";
    }
    int slash = path.lastIndexOf('/');
    return slash >= 0 ? path.substring(slash + 1) : path;
  }
}
