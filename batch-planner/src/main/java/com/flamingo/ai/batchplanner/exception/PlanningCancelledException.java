package com.flamingo.ai.batchplanner.exception;

/** Exception thrown when the planning thread is interrupted before a plan is complete. */
public class PlanningCancelledException extends RuntimeException {

  public PlanningCancelledException(String message) {
    super(message);
  }

  public PlanningCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
