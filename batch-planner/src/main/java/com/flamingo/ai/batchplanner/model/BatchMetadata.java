package com.flamingo.ai.batchplanner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive data attached to a batch.
 *
 * @param description human readable summary
 * @param efficiency how well the batch uses its token budget, 0 to 100
 * @param processingHints hints for the downstream generator
 * @param attributes strategy-specific values, kept in insertion order
 */
public record BatchMetadata(
    String description,
    int efficiency,
    ProcessingHints processingHints,
    Map<String, Object> attributes) {

  public BatchMetadata {
    efficiency = Math.max(0, Math.min(100, efficiency));
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}
