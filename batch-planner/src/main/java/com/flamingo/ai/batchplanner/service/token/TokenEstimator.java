package com.flamingo.ai.batchplanner.service.token;

/**
 * Estimates the token count of text the planner reads itself. Upstream file estimates are not
 * recomputed with this; it only sizes chunks of large files.
 */
public interface TokenEstimator {

  /**
   * Estimates the tokens in the given text.
   *
   * @param text the text, may be null or empty
   * @return the estimate, zero for null or empty text
   */
  int estimate(CharSequence text);
}
