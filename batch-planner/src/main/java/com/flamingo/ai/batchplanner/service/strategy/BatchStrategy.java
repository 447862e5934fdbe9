package com.flamingo.ai.batchplanner.service.strategy;

import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import com.flamingo.ai.batchplanner.model.IndexedFile;
import com.flamingo.ai.batchplanner.model.StrategyResult;
import java.util.List;

/**
 * Partitions the files of one size band into batches.
 *
 * <p>Strategies are registered as Spring beans and ordered with {@code @Order}; {@link
 * BatchStrategyRouter} hands each file to the first strategy that supports its token count. A
 * strategy given a file outside its range rejects it explicitly instead of dropping it.
 */
public interface BatchStrategy {

  /** Kind of every batch this strategy produces. */
  BatchKind kind();

  /**
   * Returns {@code true} if this strategy accepts a file of the given size.
   *
   * @param tokenCount normalized token count
   * @return {@code true} if supported
   */
  boolean supports(int tokenCount);

  /**
   * Builds batches for the given files.
   *
   * @param files files with their planner input positions, in input order
   * @param context collaborators for this run
   * @return batches in output order plus rejected files
   */
  StrategyResult generateBatches(List<IndexedFile> files, PlanningContext context);
}
