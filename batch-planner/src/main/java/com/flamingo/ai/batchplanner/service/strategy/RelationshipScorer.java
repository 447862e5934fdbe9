package com.flamingo.ai.batchplanner.service.strategy;

import com.flamingo.ai.batchplanner.config.PlannerConfig;
import java.util.List;
import java.util.Locale;

/**
 * Scores how strongly two small files belong in the same batch. Weights are copied from
 * configuration when the scorer is built and never change afterwards.
 */
final class RelationshipScorer {

  private final Weights weights;
  private final double nameSimilarityThreshold;
  private final double sizeSimilarityThreshold;

  RelationshipScorer(PlannerConfig.Combined config) {
    PlannerConfig.Weights source = config.getWeights();
    this.weights =
        new Weights(
            source.getSameDirectory(),
            source.getSimilarName(),
            source.getSameExtension(),
            source.getImportDependency(),
            source.getSameModule(),
            source.getSimilarSize());
    this.nameSimilarityThreshold = config.getNameSimilarityThreshold();
    this.sizeSimilarityThreshold = config.getSizeSimilarityThreshold();
  }

  int score(FileProfile a, FileProfile b) {
    int score = 0;
    if (a.parts().directory().equals(b.parts().directory())) {
      score += weights.sameDirectory();
    }
    if (nameSimilarity(a.parts().baseName(), b.parts().baseName()) > nameSimilarityThreshold) {
      score += weights.similarName();
    }
    if (a.parts().extension().equals(b.parts().extension())) {
      score += weights.sameExtension();
    }
    if (referencesEachOther(a, b)) {
      score += weights.importDependency();
    }
    if (a.parts().module().equals(b.parts().module())) {
      score += weights.sameModule();
    }
    if (sizeSimilarity(a.tokens(), b.tokens()) > sizeSimilarityThreshold) {
      score += weights.similarSize();
    }
    return score;
  }

  /** Normalized Levenshtein similarity in [0, 1]; two empty names are identical. */
  static double nameSimilarity(String a, String b) {
    String left = a.toLowerCase(Locale.ROOT);
    String right = b.toLowerCase(Locale.ROOT);
    int longest = Math.max(left.length(), right.length());
    if (longest == 0) {
      return 1.0;
    }
    return (longest - levenshtein(left, right)) / (double) longest;
  }

  static double sizeSimilarity(int a, int b) {
    int max = Math.max(a, b);
    if (max == 0) {
      return 0.0;
    }
    return Math.min(a, b) / (double) max;
  }

  static int levenshtein(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        int insertOrDelete = Math.min(current[j - 1] + 1, previous[j] + 1);
        current[j] = Math.min(insertOrDelete, previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }

  private static boolean referencesEachOther(FileProfile a, FileProfile b) {
    return mentions(a.references(), b.parts().baseName())
        || mentions(b.references(), a.parts().baseName());
  }

  /** True when a path segment of some reference names the file, with or without extension. */
  static boolean mentions(List<String> references, String baseName) {
    if (baseName.isEmpty()) {
      return false;
    }
    for (String reference : references) {
      for (String segment : reference.split("[/\\\\]")) {
        int dot = segment.indexOf('.');
        String stem = dot > 0 ? segment.substring(0, dot) : segment;
        if (segment.equals(baseName) || stem.equals(baseName)) {
          return true;
        }
      }
    }
    return false;
  }

  record Weights(
      int sameDirectory,
      int similarName,
      int sameExtension,
      int importDependency,
      int sameModule,
      int similarSize) {}
}
