package com.skycomm.planner.route;

import java.time.Instant;
import java.util.Set;

/**
 * Position of the aircraft at one instant of the mission window.
 *
 * @param timestamp sample time
 * @param latitude latitude in degrees
 * @param longitude longitude in degrees
 * @param altitudeMeters altitude in meters
 * @param headingDegrees track over ground, {@code null} when it cannot be derived
 * @param distanceMeters distance flown along the route
 * @param coveringSatellites Ka satellites whose footprint contains the position
 */
public record RouteSample(
    Instant timestamp,
    double latitude,
    double longitude,
    double altitudeMeters,
    Double headingDegrees,
    double distanceMeters,
    Set<String> coveringSatellites) {

  public RouteSample {
    coveringSatellites = coveringSatellites == null ? Set.of() : Set.copyOf(coveringSatellites);
  }

  public RouteSample withHeading(Double heading) {
    return new RouteSample(
        timestamp, latitude, longitude, altitudeMeters, heading, distanceMeters, coveringSatellites);
  }

  public RouteSample withCoverage(Set<String> satellites) {
    return new RouteSample(
        timestamp, latitude, longitude, altitudeMeters, headingDegrees, distanceMeters, satellites);
  }
}
