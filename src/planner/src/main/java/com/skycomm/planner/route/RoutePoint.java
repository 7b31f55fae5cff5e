package com.skycomm.planner.route;

import java.time.Instant;

/**
 * One vertex of a parsed route.
 *
 * @param latitude latitude in degrees
 * @param longitude longitude in degrees
 * @param altitudeMeters altitude, {@code null} when the source had none
 * @param sequence position in the route
 * @param expectedArrivalTime planned time over this point, optional
 * @param expectedSegmentSpeedKnots planned ground speed of the segment leaving this point, optional
 */
public record RoutePoint(
    double latitude,
    double longitude,
    Double altitudeMeters,
    int sequence,
    Instant expectedArrivalTime,
    Double expectedSegmentSpeedKnots) {

  public static RoutePoint of(double latitude, double longitude, int sequence) {
    return new RoutePoint(latitude, longitude, null, sequence, null, null);
  }
}
