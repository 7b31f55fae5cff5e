package com.skycomm.planner.coverage;

/**
 * Raised when the coverage footprint dataset cannot be read or parsed.
 */
public class CoverageDataException extends RuntimeException {
  public CoverageDataException(String message) {
    super(message);
  }

  public CoverageDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
