package com.skycomm.planner.geo;

/**
 * Raised when a geometric computation receives non-finite coordinates or altitude.
 */
public class GeometryInputException extends RuntimeException {
  public GeometryInputException(String message) {
    super(message);
  }
}
