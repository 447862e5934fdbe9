package com.flamingo.ai.batchplanner.service.boundary;

/**
 * A line after which a file may be cut.
 *
 * @param line 1-based line number; a cut here ends the chunk with this line
 * @param type kind of boundary
 */
public record BoundaryCandidate(int line, BoundaryType type) {

  public int priority() {
    return type.getPriority();
  }
}
