package com.skycomm.planner.rules;

/**
 * Outcome of a line-of-sight check for the X antenna.
 *
 * @param absoluteAzimuth true azimuth to the satellite
 * @param relativeAzimuth azimuth relative to the aircraft heading, {@code null} without heading
 * @param elevation elevation to the satellite
 * @param elevationBelowMinimum true when the elevation floor is not met
 * @param refuelingMode true when the refueling exclusion range was applied
 * @param reason tagged violation reason, {@link ViolationReason#NONE} when clear
 */
public record AzimuthEvaluation(
    double absoluteAzimuth,
    Double relativeAzimuth,
    double elevation,
    boolean elevationBelowMinimum,
    boolean refuelingMode,
    ViolationReason reason) {

  public boolean violated() {
    return reason != ViolationReason.NONE;
  }

  /** Azimuth the exclusion ranges were tested against. */
  public double testedAzimuth() {
    return relativeAzimuth != null ? relativeAzimuth : absoluteAzimuth;
  }
}
