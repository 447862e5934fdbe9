package com.flamingo.ai.batchplanner.service.strategy;

import java.util.Locale;

/**
 * Pieces of a forward-slash file path used by the grouping heuristics.
 *
 * @param directory parent directory path, empty for root-level files
 * @param module name of the grandparent directory, empty when there is none
 * @param fileName last path segment
 * @param baseName file name up to the first dot
 * @param extension lower-case text after the last dot, empty when absent
 */
record PathParts(
    String directory, String module, String fileName, String baseName, String extension) {

  static PathParts parse(String path) {
    String normalized = path.replace('\\', '/');
    String[] segments = normalized.split("/");
    String fileName = segments[segments.length - 1];
    int slash = normalized.lastIndexOf('/');
    String directory = slash >= 0 ? normalized.substring(0, slash) : "";
    String module = segments.length >= 3 ? segments[segments.length - 3] : "";
    int firstDot = fileName.indexOf('.');
    String baseName = firstDot > 0 ? fileName.substring(0, firstDot) : fileName;
    int lastDot = fileName.lastIndexOf('.');
    String extension = lastDot > 0 ? fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    return new PathParts(directory, module, fileName, baseName, extension);
  }

  String lowerFileName() {
    return fileName.toLowerCase(Locale.ROOT);
  }
}
