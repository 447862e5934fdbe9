package com.flamingo.ai.batchplanner.model;

import com.flamingo.ai.batchplanner.domain.enums.ChunkType;

/**
 * Position and content of one chunk of a large file.
 *
 * @param chunkIndex 1-based index within the parent file
 * @param totalChunks number of chunks the parent file was cut into
 * @param startLine first line of the parent file covered, 1-based; 0 when the range is unknown
 * @param endLine last line of the parent file covered, inclusive; 0 when the range is unknown
 * @param content chunk text including the marker line and any carried imports
 * @param splitType dominant structure of the chunk
 * @param splitQuality quality of the cut, 0 to 100
 * @param fallback whether the chunk came from equal line-count splitting
 * @param overlapTokens tokens of carried import context prepended to the content
 */
public record ChunkInfo(
    int chunkIndex,
    int totalChunks,
    int startLine,
    int endLine,
    String content,
    ChunkType splitType,
    int splitQuality,
    boolean fallback,
    int overlapTokens) {

  public boolean isFirst() {
    return chunkIndex == 1;
  }

  public boolean isLast() {
    return chunkIndex == totalChunks;
  }

  public int lineCount() {
    return startLine > 0 ? endLine - startLine + 1 : 0;
  }
}
