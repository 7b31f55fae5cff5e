package com.skycomm.planner.rules;

import com.skycomm.planner.geo.LookAngles;
import com.skycomm.planner.geo.SatelliteGeometry;
import java.time.Duration;

/**
 * Antenna and buffer limits applied during one timeline build.
 *
 * @param normalAzimuthMin start of the aft exclusion arc, relative to the nose
 * @param normalAzimuthMax end of the aft exclusion arc
 * @param refuelingAzimuthMin start of the refueling exclusion arc, may wrap through 0
 * @param refuelingAzimuthMax end of the refueling exclusion arc
 * @param transitionBuffer half-width of a satellite transition window
 * @param takeoffBuffer length of the takeoff safety window
 * @param landingBuffer length of the landing safety window
 * @param minimumElevation elevation floor in degrees
 */
public record ConstraintConfig(
    double normalAzimuthMin,
    double normalAzimuthMax,
    double refuelingAzimuthMin,
    double refuelingAzimuthMax,
    Duration transitionBuffer,
    Duration takeoffBuffer,
    Duration landingBuffer,
    double minimumElevation) {

  public static ConstraintConfig defaults() {
    return new ConstraintConfig(
        135.0, 225.0, 315.0, 45.0,
        Duration.ofMinutes(15), Duration.ofMinutes(15), Duration.ofMinutes(15),
        0.0);
  }

  /**
   * Evaluates line of sight from the aircraft to an X satellite. The elevation floor is tested
   * first; the azimuth arc is the refueling one when {@code refuelingMode} is set, the aft one
   * otherwise.
   *
   * @param latitude aircraft latitude
   * @param longitude aircraft longitude
   * @param altitudeMeters aircraft altitude
   * @param headingDegrees aircraft heading, {@code null} to test the absolute azimuth
   * @param satelliteLongitude satellite longitude
   * @param refuelingMode whether the sample lies inside a refueling window
   */
  public AzimuthEvaluation evaluate(
      double latitude,
      double longitude,
      double altitudeMeters,
      Double headingDegrees,
      double satelliteLongitude,
      boolean refuelingMode) {
    LookAngles angles =
        SatelliteGeometry.lookAngles(latitude, longitude, altitudeMeters, satelliteLongitude);
    Double relative = headingDegrees == null
        ? null
        : SatelliteGeometry.relativeAzimuth(angles.azimuthDegrees(), headingDegrees);
    double tested = relative != null ? relative : angles.azimuthDegrees();
    boolean belowFloor = angles.elevationDegrees() < minimumElevation;

    ViolationReason reason;
    if (belowFloor) {
      reason = ViolationReason.ELEVATION_BELOW_MINIMUM;
    } else if (refuelingMode) {
      reason = SatelliteGeometry.isInAzimuthRange(tested, refuelingAzimuthMin, refuelingAzimuthMax)
          ? ViolationReason.REFUELING_CONE
          : ViolationReason.NONE;
    } else {
      reason = SatelliteGeometry.isInAzimuthRange(tested, normalAzimuthMin, normalAzimuthMax)
          ? ViolationReason.AFT_CONE
          : ViolationReason.NONE;
    }
    return new AzimuthEvaluation(
        angles.azimuthDegrees(), relative, angles.elevationDegrees(), belowFloor, refuelingMode, reason);
  }
}
