package com.flamingo.ai.batchplanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.batchplanner.domain.enums.AnalysisDepth;
import java.util.List;
import lombok.Builder;

/**
 * Advisory hints for the downstream documentation generator. Which fields are set depends on the
 * strategy that produced the batch; unset fields are null.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingHints(
    AnalysisDepth analysisDepth,
    List<String> focusAreas,
    List<String> specialHandling,
    List<String> specialInstructions,
    String documentationStyle,
    Boolean contextAware,
    Boolean crossFileReferences,
    Boolean preserveRelationships,
    Integer avgTokensPerFile,
    List<String> directories,
    List<String> extensions,
    List<String> modules,
    Integer importance,
    Integer complexity,
    Boolean firstChunk,
    Boolean lastChunk,
    Boolean requiresIntegration,
    Boolean hasImports,
    Boolean hasExports) {

  public ProcessingHints {
    focusAreas = focusAreas == null ? null : List.copyOf(focusAreas);
    specialHandling = specialHandling == null ? null : List.copyOf(specialHandling);
    specialInstructions = specialInstructions == null ? null : List.copyOf(specialInstructions);
    directories = directories == null ? null : List.copyOf(directories);
    extensions = extensions == null ? null : List.copyOf(extensions);
    modules = modules == null ? null : List.copyOf(modules);
  }
}
