package com.flamingo.ai.batchplanner.model;

import java.util.List;

/**
 * Information needed to stitch chunk documentation back into one file-level document.
 *
 * @param position 1-based chunk position
 * @param total number of chunks of the parent file
 * @param needsContextFromPrevious whether a previous chunk exists
 * @param providesContextForNext whether a following chunk exists
 * @param hasOverlap whether carried import context was prepended
 * @param integrationPoints boundaries found in the chunk
 * @param expectedLineRange parent line range covered, such as {@code 1-660}
 * @param relativePosition position as a fraction of the file, 0 to 1
 * @param estimatedComplexity heuristic complexity, 1 to 10
 */
public record ReconstructionInfo(
    int position,
    int total,
    boolean needsContextFromPrevious,
    boolean providesContextForNext,
    boolean hasOverlap,
    List<IntegrationPoint> integrationPoints,
    String expectedLineRange,
    double relativePosition,
    double estimatedComplexity) {

  public ReconstructionInfo {
    integrationPoints = integrationPoints == null ? List.of() : List.copyOf(integrationPoints);
  }
}
