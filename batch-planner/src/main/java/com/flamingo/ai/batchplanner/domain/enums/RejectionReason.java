package com.flamingo.ai.batchplanner.domain.enums;

/** Defines why a file was not placed in any batch. */
public enum RejectionReason {
  /** Token count below the range the strategy accepts. */
  TOO_SMALL,

  /** Token count at or above the range the strategy accepts. */
  TOO_LARGE,

  /** Upstream token estimation failed for the file. */
  ESTIMATION_ERROR,

  /** The same path appeared earlier in the input. */
  DUPLICATE_PATH,

  /** No strategy accepted the file, even after re-routing. */
  UNPLANNABLE
}
