package com.flamingo.ai.batchplanner.service.boundary;

import java.util.List;

/**
 * Outcome of boundary detection for one file.
 *
 * @param success whether chunks were produced
 * @param language language whose rules were applied
 * @param chunks chunks in file order, empty on failure
 * @param error failure description, null on success
 */
public record DetectionResult(
    boolean success, String language, List<DetectedChunk> chunks, String error) {

  public DetectionResult {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }

  public static DetectionResult success(String language, List<DetectedChunk> chunks) {
    return new DetectionResult(true, language, chunks, null);
  }

  public static DetectionResult failure(String language, String error) {
    return new DetectionResult(false, language, List.of(), error);
  }
}
