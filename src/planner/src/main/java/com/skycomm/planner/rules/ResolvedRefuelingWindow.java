package com.skycomm.planner.rules;

import java.time.Instant;

/**
 * Refueling window placed on the time axis.
 */
public record ResolvedRefuelingWindow(
    String id, String startWaypointName, String endWaypointName, Instant start, Instant end) {

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && !instant.isAfter(end);
  }
}
