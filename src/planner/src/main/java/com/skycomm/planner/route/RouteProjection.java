package com.skycomm.planner.route;

import java.time.Instant;

/**
 * Nearest on-route position to an arbitrary location.
 *
 * @param latitude projected latitude
 * @param longitude projected longitude
 * @param distanceAlongMeters route progress at the projected position
 * @param segmentIndex index of the route segment holding the projection
 * @param offRouteMeters distance between the location and its projection
 * @param timestamp time the aircraft is expected at the projected position
 */
public record RouteProjection(
    double latitude,
    double longitude,
    double distanceAlongMeters,
    int segmentIndex,
    double offRouteMeters,
    Instant timestamp) {}
