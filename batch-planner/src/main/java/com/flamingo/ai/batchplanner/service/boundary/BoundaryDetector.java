package com.flamingo.ai.batchplanner.service.boundary;

import com.flamingo.ai.batchplanner.model.StructuralSummary;

/** Proposes cut points in a large file so that each piece stays near a token target. */
public interface BoundaryDetector {

  /**
   * Splits the content into chunks aligned with structural boundaries.
   *
   * <p>Implementations never throw for malformed code. Detection reports {@code success = false}
   * only when the content is empty or detection itself fails, and the caller then falls back to
   * equal line-count splitting.
   *
   * @param path file path, used for language detection and logging
   * @param content full file content
   * @param summary analyzer output for the file, may be null
   * @param targetTokens preferred chunk size in this detector's estimator units
   * @return the detection result
   */
  DetectionResult detect(String path, String content, StructuralSummary summary, int targetTokens);
}
