package com.flamingo.ai.batchplanner.service.strategy;

import com.flamingo.ai.batchplanner.model.StructuralSummary;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Path and structure heuristics used to rank and describe single-file batches. */
final class SingleFileHeuristics {

  static final int HIGH_COMPLEXITY_SCORE = 15;
  static final int MANY_FUNCTIONS = 20;
  static final int MANY_CLASSES = 5;
  static final int MANY_DEPENDENCIES = 10;
  static final int NEAR_LIMIT_TOKENS = 19000;

  private SingleFileHeuristics() {}

  /** Ranks how central a file is to the project, 0 to 100. */
  static int importance(String path, StructuralSummary summary) {
    String lower = path.toLowerCase(Locale.ROOT);
    String fileName = PathParts.parse(lower).fileName();
    String segments = "/" + lower;
    int importance = 50;

    if (fileName.contains("index.")) {
      importance += 20;
    }
    if (fileName.contains("main.")) {
      importance += 18;
    }
    if (fileName.contains("app.")) {
      importance += 15;
    }
    if (fileName.contains("server.")) {
      importance += 15;
    }
    if (fileName.contains("config")) {
      importance += 12;
    }
    if (fileName.contains("route")) {
      importance += 10;
    }
    if (fileName.contains("controller")) {
      importance += 10;
    }
    if (fileName.contains("service")) {
      importance += 8;
    }
    if (fileName.contains("util") || fileName.contains("helper")) {
      importance += 5;
    }
    if (fileName.contains("test") || fileName.contains("spec")) {
      importance -= 10;
    }

    if (segments.contains("/src/") || segments.contains("/lib/")) {
      importance += 8;
    }
    if (segments.contains("/server/") || segments.contains("/backend/")) {
      importance += 6;
    }
    if (segments.contains("/api/")) {
      importance += 6;
    }
    if (segments.contains("/components/")) {
      importance += 5;
    }
    if (segments.contains("/test/") || segments.contains("/tests/")) {
      importance -= 5;
    }

    importance += summary.exports().size() * 3;
    importance += summary.classes().size() * 4;
    importance += summary.functions().size() * 2;
    importance += summary.interfaces().size() * 3;
    return Math.max(0, Math.min(100, importance));
  }

  /** Estimates how hard a file is to document, 0 to 100. */
  static int complexity(int tokens, StructuralSummary summary) {
    double complexity = 10;
    complexity += Math.min(tokens / 1000.0, 20);
    complexity += summary.functions().size() * 2;
    complexity += summary.classes().size() * 4;
    complexity += summary.interfaces().size() * 3;
    complexity += summary.complexityScore() * 0.1;
    complexity += summary.maxNesting() * 3;
    return (int) Math.round(Math.min(complexity, 100));
  }

  static List<String> focusAreas(String path) {
    String lower = path.toLowerCase(Locale.ROOT);
    List<String> areas = new ArrayList<>();
    if (lower.contains("api") || lower.contains("router") || lower.contains("controller")) {
      areas.add("api_design");
      areas.add("endpoint_documentation");
    }
    if (lower.contains("service") || lower.contains("business")) {
      areas.add("business_logic");
      areas.add("service_patterns");
    }
    if (lower.contains("model") || lower.contains("entity")) {
      areas.add("data_structures");
      areas.add("relationships");
    }
    if (lower.contains("util") || lower.contains("helper")) {
      areas.add("utility_functions");
      areas.add("reusability");
    }
    if (lower.contains("config")) {
      areas.add("configuration");
      areas.add("environment_settings");
    }
    if (lower.contains("test")) {
      areas.add("test_coverage");
      areas.add("test_patterns");
    }
    return areas.isEmpty() ? List.of("general_analysis") : areas;
  }

  static List<String> specialHandling(int tokens, StructuralSummary summary) {
    List<String> flags = new ArrayList<>();
    if (summary.complexityScore() > HIGH_COMPLEXITY_SCORE) {
      flags.add("high_complexity");
    }
    if (summary.functions().size() > MANY_FUNCTIONS) {
      flags.add("many_functions");
    }
    if (summary.classes().size() > MANY_CLASSES) {
      flags.add("many_classes");
    }
    if (summary.dependencies().external().size() > MANY_DEPENDENCIES) {
      flags.add("many_dependencies");
    }
    if (tokens > NEAR_LIMIT_TOKENS) {
      flags.add("large_file");
    }
    return flags;
  }

  static String documentationStyle(String path) {
    String lower = path.toLowerCase(Locale.ROOT);
    if (lower.contains("api") || lower.contains("swagger")) {
      return "api_focused";
    }
    if (lower.contains("test")) {
      return "test_focused";
    }
    if (lower.contains("config")) {
      return "configuration_focused";
    }
    if (lower.contains("util") || lower.contains("helper")) {
      return "utility_focused";
    }
    return "comprehensive";
  }

  static String architecturalRole(String path) {
    String lower = path.toLowerCase(Locale.ROOT);
    if (lower.contains("controller")) {
      return "controller";
    }
    if (lower.contains("service")) {
      return "service layer";
    }
    if (lower.contains("model")) {
      return "data model";
    }
    if (lower.contains("route")) {
      return "router";
    }
    if (lower.contains("middleware")) {
      return "middleware";
    }
    if (lower.contains("util") || lower.contains("helper")) {
      return "utility";
    }
    if (lower.contains("config")) {
      return "configuration";
    }
    if (lower.contains("test")) {
      return "test";
    }
    return "business module";
  }

  static String projectContext(String path) {
    String segments = "/" + path.toLowerCase(Locale.ROOT);
    if (segments.contains("/api/")) {
      return "API service";
    }
    if (segments.contains("/frontend/") || segments.contains("/client/")) {
      return "frontend application";
    }
    if (segments.contains("/backend/") || segments.contains("/server/")) {
      return "backend service";
    }
    if (segments.contains("/shared/") || segments.contains("/common/")) {
      return "shared module";
    }
    return "general project";
  }

  /** Quality of the file as a documentation unit, 70 to 100. */
  static int qualityScore(int tokens, StructuralSummary summary) {
    int score = 70;
    if (tokens >= 16000 && tokens <= 18000) {
      score += 10;
    }
    if (!summary.functions().isEmpty()) {
      score += 5;
    }
    if (!summary.classes().isEmpty()) {
      score += 5;
    }
    if (!summary.exports().isEmpty()) {
      score += 5;
    }
    if (!summary.imports().isEmpty()) {
      score += 3;
    }
    return Math.min(score, 100);
  }
}
