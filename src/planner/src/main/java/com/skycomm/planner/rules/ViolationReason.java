package com.skycomm.planner.rules;

/**
 * Why the X antenna cannot hold its satellite at a given sample.
 */
public enum ViolationReason {
  NONE,
  /** Satellite below the minimum elevation. Takes priority over azimuth cones. */
  ELEVATION_BELOW_MINIMUM,
  /** Satellite inside the aft cone shared with the Ku antenna. */
  AFT_CONE,
  /** Satellite inside the forward cone blocked during refueling. */
  REFUELING_CONE
}
