package com.flamingo.ai.batchplanner.model;

import java.util.List;

/**
 * Output of one strategy run: the batches built and the files the strategy declined.
 *
 * @param batches batches in output order
 * @param rejected files outside the strategy's accepted range
 */
public record StrategyResult(List<Batch> batches, List<RejectedFile> rejected) {

  public StrategyResult {
    batches = batches == null ? List.of() : List.copyOf(batches);
    rejected = rejected == null ? List.of() : List.copyOf(rejected);
  }

  public static StrategyResult empty() {
    return new StrategyResult(List.of(), List.of());
  }
}
