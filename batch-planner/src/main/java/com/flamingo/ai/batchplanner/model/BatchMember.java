package com.flamingo.ai.batchplanner.model;

/**
 * One file inside a batch. For chunk batches the token count is that of the chunk.
 *
 * @param path file path
 * @param tokenCount tokens this member contributes to the batch
 * @param sizeBytes file size in bytes
 * @param language detected language, may be null
 * @param originalIndex zero-based index of the file in the planner input
 * @param priority strategy-specific ordering weight
 */
public record BatchMember(
    String path,
    int tokenCount,
    long sizeBytes,
    String language,
    int originalIndex,
    double priority) {

  public static BatchMember of(IndexedFile file, int tokenCount, double priority) {
    SourceFileRef ref = file.file();
    return new BatchMember(
        ref.path(), tokenCount, ref.sizeBytes(), ref.language(), file.originalIndex(), priority);
  }
}
