package com.flamingo.ai.batchplanner.model;

/**
 * A source file paired with its position in the planner input.
 *
 * @param file the file
 * @param originalIndex zero-based index in the planner input
 */
public record IndexedFile(SourceFileRef file, int originalIndex) {

  public String path() {
    return file.path();
  }

  public int tokenCount() {
    return file.tokenCount();
  }
}
