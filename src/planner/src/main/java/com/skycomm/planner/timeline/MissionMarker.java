package com.skycomm.planner.timeline;

import java.time.Instant;

/**
 * Positioned point of interest generated from the mission plan, e.g. where a Ka swap happens.
 */
public record MissionMarker(
    MarkerType type, String label, Instant timestamp, double latitude, double longitude, String satelliteId) {

  public enum MarkerType {
    X_TRANSITION,
    KA_GAP_START,
    KA_GAP_END,
    KA_SWAP,
    REFUELING_START,
    REFUELING_END
  }
}
