package com.flamingo.ai.batchplanner.service.boundary;

import com.flamingo.ai.batchplanner.domain.enums.ChunkType;
import java.util.List;

/**
 * One contiguous line range proposed by a {@link BoundaryDetector}.
 *
 * @param startLine first line, 1-based
 * @param endLine last line, inclusive
 * @param content marker line, carried imports and the lines themselves
 * @param estimatedTokens tokens of the line range alone, in the detector's estimator units
 * @param type dominant structure of the range
 * @param boundaries structural boundaries inside the range
 * @param carriedImportLines import lines repeated from the file header
 * @param overlapTokens tokens of the carried import lines
 * @param hasChunkMarker whether the content starts with a chunk marker line
 */
public record DetectedChunk(
    int startLine,
    int endLine,
    String content,
    int estimatedTokens,
    ChunkType type,
    List<BoundaryCandidate> boundaries,
    List<String> carriedImportLines,
    int overlapTokens,
    boolean hasChunkMarker) {

  public DetectedChunk {
    boundaries = boundaries == null ? List.of() : List.copyOf(boundaries);
    carriedImportLines = carriedImportLines == null ? List.of() : List.copyOf(carriedImportLines);
  }

  public int lineCount() {
    return endLine - startLine + 1;
  }

  public boolean hasCarriedImports() {
    return !carriedImportLines.isEmpty();
  }
}
