package com.flamingo.ai.batchplanner.service.strategy;

import com.flamingo.ai.batchplanner.service.reader.FileContentReader;
import java.io.IOException;

/**
 * Collaborators available to a strategy during one planning run.
 *
 * @param contentReader reads file content for strategies that split files
 */
public record PlanningContext(FileContentReader contentReader) {

  /** Context for strategies that never read content; any read fails. */
  public static PlanningContext withoutContent() {
    return new PlanningContext(
        path -> {
          throw new IOException("No content reader configured for " + path);
        });
  }
}
