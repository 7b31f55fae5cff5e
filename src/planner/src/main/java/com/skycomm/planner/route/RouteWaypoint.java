package com.skycomm.planner.route;

import java.time.Instant;

/**
 * Named route waypoint.
 *
 * @param name waypoint name, matched case-insensitively
 * @param latitude latitude in degrees
 * @param longitude longitude in degrees
 * @param order waypoint order on the route
 * @param role role tag such as {@code departure}, {@code arrival} or {@code waypoint}
 * @param expectedArrivalTime planned time over the waypoint, optional
 */
public record RouteWaypoint(
    String name,
    double latitude,
    double longitude,
    int order,
    String role,
    Instant expectedArrivalTime) {}
