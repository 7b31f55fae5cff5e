package com.skycomm.planner.mission;

/**
 * Aggregate status of a timeline segment, derived from how many transports are not available.
 */
public enum TimelineStatus {
  NOMINAL,
  DEGRADED,
  CRITICAL;

  public static TimelineStatus fromImpactedCount(int impacted) {
    if (impacted <= 0) {
      return NOMINAL;
    }
    return impacted == 1 ? DEGRADED : CRITICAL;
  }
}
