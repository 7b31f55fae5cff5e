package com.skycomm.planner.route;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A route as handed over by the route source: ordered points, named waypoints and timing.
 */
public record ParsedRoute(
    String id,
    String name,
    List<RoutePoint> points,
    List<RouteWaypoint> waypoints,
    RouteTimingProfile timing) {

  public ParsedRoute {
    points = points == null ? List.of() : List.copyOf(points);
    waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
    timing = timing == null ? RouteTimingProfile.NONE : timing;
  }

  public Optional<RouteWaypoint> findWaypoint(String waypointName) {
    if (waypointName == null) {
      return Optional.empty();
    }
    String wanted = waypointName.trim().toLowerCase(Locale.ROOT);
    return waypoints.stream()
        .filter(waypoint -> waypoint.name() != null)
        .filter(waypoint -> waypoint.name().trim().toLowerCase(Locale.ROOT).equals(wanted))
        .findFirst();
  }

  public Optional<RoutePoint> destination() {
    return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1));
  }

  public boolean hasTimingData() {
    return timing.hasTimingData()
        || points.stream().anyMatch(point -> point.expectedArrivalTime() != null);
  }
}
