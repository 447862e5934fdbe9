package com.flamingo.ai.batchplanner.model;

import com.flamingo.ai.batchplanner.domain.enums.RejectionReason;

/**
 * A file that was not placed in any batch.
 *
 * @param path file path
 * @param tokenCount normalized token count at rejection time
 * @param reason why the file was rejected
 * @param detail human readable explanation
 */
public record RejectedFile(String path, int tokenCount, RejectionReason reason, String detail) {

  public static RejectedFile of(IndexedFile file, RejectionReason reason, String detail) {
    return new RejectedFile(file.path(), file.tokenCount(), reason, detail);
  }
}
