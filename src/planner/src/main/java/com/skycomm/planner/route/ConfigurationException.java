package com.skycomm.planner.route;

/**
 * Raised when a route or mission lacks the data needed to place it on a time axis.
 */
public class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }
}
