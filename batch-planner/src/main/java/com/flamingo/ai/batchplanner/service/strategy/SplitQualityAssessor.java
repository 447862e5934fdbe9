package com.flamingo.ai.batchplanner.service.strategy;

import com.flamingo.ai.batchplanner.config.PlannerConfig;
import com.flamingo.ai.batchplanner.domain.enums.ChunkType;
import com.flamingo.ai.batchplanner.service.boundary.BoundaryCandidate;
import com.flamingo.ai.batchplanner.service.boundary.BoundaryType;
import com.flamingo.ai.batchplanner.service.boundary.DetectedChunk;

/**
 * Scores how well a chunk was cut, 0 to 100, as a weighted sum of structural integrity, context
 * preservation, size balance, dependency handling and readability.
 */
final class SplitQualityAssessor {

  private static final int MAX_HIGH_PRIORITY_BONUS = 15;

  private final Weights weights;

  SplitQualityAssessor(PlannerConfig.QualityWeights source) {
    this.weights =
        new Weights(
            source.getStructuralIntegrity(),
            source.getContextPreservation(),
            source.getSizeBalance(),
            source.getDependencyHandling(),
            source.getReadability());
  }

  int assess(DetectedChunk chunk, int chunkTokens, int targetTokens, boolean hasComments) {
    double score =
        structuralIntegrity(chunk) * weights.structuralIntegrity()
            + contextPreservation(chunk, hasComments) * weights.contextPreservation()
            + sizeBalance(chunkTokens, targetTokens) * weights.sizeBalance()
            + dependencyHandling(chunk) * weights.dependencyHandling()
            + readability(chunk) * weights.readability();
    return (int) Math.max(0, Math.min(100, Math.round(score)));
  }

  static int structuralIntegrity(DetectedChunk chunk) {
    int score = 50;
    if (!chunk.boundaries().isEmpty()) {
      score += 20;
    }
    score +=
        switch (chunk.type()) {
          case CLASS_FOCUSED -> 25;
          case INTERFACE_FOCUSED -> 20;
          case FUNCTION_FOCUSED -> 18;
          case MODULE_FOCUSED -> 15;
          default -> 5;
        };
    return Math.min(score, 100);
  }

  static int contextPreservation(DetectedChunk chunk, boolean hasComments) {
    int score = 60;
    boolean hasImports =
        chunk.hasCarriedImports()
            || chunk.boundaries().stream().anyMatch(b -> b.type() == BoundaryType.MODULE);
    if (hasImports) {
      score += 15;
    }
    if (hasComments) {
      score += 10;
    }
    long strong =
        chunk.boundaries().stream()
            .mapToInt(BoundaryCandidate::priority)
            .filter(priority -> priority >= BoundaryType.HIGH_PRIORITY)
            .count();
    score += (int) Math.min(strong * 5, MAX_HIGH_PRIORITY_BONUS);
    return Math.min(score, 100);
  }

  static int sizeBalance(int chunkTokens, int targetTokens) {
    int max = Math.max(chunkTokens, targetTokens);
    if (max == 0) {
      return 0;
    }
    return (int) Math.round(Math.min(chunkTokens, targetTokens) * 100.0 / max);
  }

  static int dependencyHandling(DetectedChunk chunk) {
    int score = 70;
    if (chunk.hasCarriedImports()) {
      score += 20;
    }
    if (chunk.endLine() > chunk.startLine()) {
      score += 10;
    }
    return Math.min(score, 100);
  }

  static int readability(DetectedChunk chunk) {
    int score = 75;
    if (chunk.hasChunkMarker()) {
      score += 15;
    }
    if (chunk.lineCount() > 10 && chunk.lineCount() < 500) {
      score += 10;
    }
    return Math.min(score, 100);
  }

  /** Heuristic effort to document a chunk, 1 to 10. */
  static double chunkComplexity(ChunkType type, int chunkTokens, int boundaryCount) {
    double complexity = 1 + Math.min(chunkTokens / 5000.0, 5) + boundaryCount * 0.5;
    complexity +=
        switch (type) {
          case CLASS_FOCUSED -> 2;
          case FUNCTION_FOCUSED -> 1;
          case MIXED -> 1.5;
          default -> 0;
        };
    return Math.round(Math.min(complexity, 10) * 10) / 10.0;
  }

  private record Weights(
      double structuralIntegrity,
      double contextPreservation,
      double sizeBalance,
      double dependencyHandling,
      double readability) {}
}
