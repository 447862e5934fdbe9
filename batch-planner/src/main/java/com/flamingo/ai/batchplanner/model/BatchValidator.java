package com.flamingo.ai.batchplanner.model;

import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import com.flamingo.ai.batchplanner.exception.InvalidBatchException;
import java.util.ArrayList;
import java.util.List;

/** Structural checks every batch must pass before it leaves the planner. */
public final class BatchValidator {

  private BatchValidator() {}

  public static boolean isValid(Batch batch) {
    return validate(batch).isEmpty();
  }

  /**
   * Lists every invariant the batch breaks.
   *
   * @param batch the batch to check, may be null
   * @return problem descriptions, empty when the batch is valid
   */
  public static List<String> validate(Batch batch) {
    List<String> problems = new ArrayList<>();
    if (batch == null) {
      problems.add("batch is null");
      return problems;
    }
    if (batch.id() == null || batch.id().isBlank()) {
      problems.add("id is missing");
    }
    if (batch.kind() == null) {
      problems.add("kind is missing");
      return problems;
    }
    if (!batch.kind().getStrategyTag().equals(batch.strategyTag())) {
      problems.add(
          "strategy tag '"
              + batch.strategyTag()
              + "' does not match kind "
              + batch.kind().getTypeName());
    }
    if (batch.estimatedTokens() < 0) {
      problems.add("estimatedTokens is negative");
    }
    if (batch.metadata() == null) {
      problems.add("metadata is missing");
    }
    if (batch.members().isEmpty()) {
      problems.add("batch has no members");
    }
    if (batch.kind() != BatchKind.COMBINED && batch.members().size() > 1) {
      problems.add(batch.kind().getTypeName() + " must have exactly one member");
    }
    if (batch.kind() == BatchKind.CHUNK) {
      validateChunk(batch, problems);
    } else {
      long memberTokens = batch.members().stream().mapToLong(BatchMember::tokenCount).sum();
      if (memberTokens != batch.estimatedTokens()) {
        problems.add(
            "estimatedTokens " + batch.estimatedTokens() + " != member sum " + memberTokens);
      }
      if (batch.chunkInfo() != null || batch.parentFileRef() != null) {
        problems.add("chunk fields set on a " + batch.kind().getTypeName());
      }
    }
    return problems;
  }

  /** Same as {@link #validate(Batch)}, also capping the member count of combined batches. */
  public static List<String> validate(Batch batch, int maxFilesPerBatch) {
    List<String> problems = validate(batch);
    if (batch != null
        && batch.kind() == BatchKind.COMBINED
        && batch.members().size() > maxFilesPerBatch) {
      problems.add(
          "combined batch has "
              + batch.members().size()
              + " members, more than "
              + maxFilesPerBatch);
    }
    return problems;
  }

  /** Throws when the batch breaks an invariant; strategies calling this have a bug. */
  public static Batch requireValid(Batch batch) {
    return requireValid(batch, validate(batch));
  }

  public static Batch requireValid(Batch batch, int maxFilesPerBatch) {
    return requireValid(batch, validate(batch, maxFilesPerBatch));
  }

  private static Batch requireValid(Batch batch, List<String> problems) {
    if (!problems.isEmpty()) {
      throw new InvalidBatchException(batch == null ? null : batch.id(), problems);
    }
    return batch;
  }

  private static void validateChunk(Batch batch, List<String> problems) {
    ChunkInfo chunk = batch.chunkInfo();
    if (chunk == null) {
      problems.add("chunkInfo is missing");
    } else {
      if (chunk.chunkIndex() < 1 || chunk.chunkIndex() > chunk.totalChunks()) {
        problems.add(
            "chunkIndex " + chunk.chunkIndex() + " outside 1.." + chunk.totalChunks());
      }
      if (chunk.startLine() > chunk.endLine()) {
        problems.add("startLine " + chunk.startLine() + " after endLine " + chunk.endLine());
      }
      if (chunk.splitQuality() < 0 || chunk.splitQuality() > 100) {
        problems.add("splitQuality outside 0..100");
      }
    }
    if (batch.parentFileRef() == null) {
      problems.add("parentFileRef is missing");
    } else if (!batch.members().isEmpty()
        && !batch.parentFileRef().path().equals(batch.members().get(0).path())) {
      problems.add("chunk member does not match parent file");
    }
    if (batch.reconstructionInfo() == null) {
      problems.add("reconstructionInfo is missing");
    }
  }
}
