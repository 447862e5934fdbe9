package com.flamingo.ai.batchplanner.exception;

import java.util.List;

/** Exception thrown when a strategy produces a batch that breaks the batch invariants. */
public class InvalidBatchException extends RuntimeException {

  private final String batchId;
  private final List<String> problems;

  public InvalidBatchException(String batchId, List<String> problems) {
    super("Invalid batch " + batchId + ": " + String.join("; ", problems));
    this.batchId = batchId;
    this.problems = List.copyOf(problems);
  }

  public String getBatchId() {
    return batchId;
  }

  public List<String> getProblems() {
    return problems;
  }
}
