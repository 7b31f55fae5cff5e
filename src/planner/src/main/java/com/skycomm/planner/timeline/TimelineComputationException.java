package com.skycomm.planner.timeline;

/**
 * Wraps any unexpected failure of a timeline build. No partial timeline is returned.
 */
public class TimelineComputationException extends RuntimeException {
  public TimelineComputationException(String message, Throwable cause) {
    super(message, cause);
  }
}
