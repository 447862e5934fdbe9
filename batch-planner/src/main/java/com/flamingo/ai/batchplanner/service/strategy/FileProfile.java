package com.flamingo.ai.batchplanner.service.strategy;

import com.flamingo.ai.batchplanner.model.IndexedFile;
import com.flamingo.ai.batchplanner.model.StructuralSummary;
import java.util.List;
import java.util.Locale;

/**
 * Precomputed facts about a small file, built once per planning run.
 *
 * @param file the file and its input position
 * @param parts parsed path
 * @param tokens normalized token count
 * @param priority grouping priority, higher files seed groups first
 * @param references internal dependencies named by the file
 */
record FileProfile(
    IndexedFile file, PathParts parts, int tokens, double priority, List<String> references) {

  static FileProfile of(IndexedFile file) {
    PathParts parts = PathParts.parse(file.path());
    int tokens = file.tokenCount();
    StructuralSummary summary = file.file().summaryOrEmpty();
    return new FileProfile(
        file,
        parts,
        tokens,
        priority(file.path(), tokens),
        List.copyOf(summary.dependencies().internal()));
  }

  /** Entry points and configuration seed groups before ordinary files; larger files break ties. */
  static double priority(String path, int tokens) {
    String lower = path.toLowerCase(Locale.ROOT);
    double priority = 0;
    if (lower.contains("index.")) {
      priority += 5;
    }
    if (lower.contains("main.")) {
      priority += 4;
    }
    if (lower.contains("config")) {
      priority += 3;
    }
    if (lower.contains("test")) {
      priority += 1;
    }
    return priority + Math.min(tokens / 1000.0, 5.0);
  }

  int originalIndex() {
    return file.originalIndex();
  }
}
