package com.flamingo.ai.batchplanner.model;

/**
 * A named declaration found by the upstream analyzer.
 *
 * @param name declared name
 * @param startLine first line, 1-based, or 0 when unknown
 * @param endLine last line, 1-based, or 0 when unknown
 */
public record CodeSymbol(String name, int startLine, int endLine) {

  public static CodeSymbol named(String name) {
    return new CodeSymbol(name, 0, 0);
  }

  public boolean hasRange() {
    return startLine > 0 && endLine >= startLine;
  }
}
