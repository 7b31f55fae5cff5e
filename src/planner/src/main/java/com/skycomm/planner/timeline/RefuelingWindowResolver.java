package com.skycomm.planner.timeline;

import com.skycomm.planner.mission.RefuelingWindow;
import com.skycomm.planner.route.ParsedRoute;
import com.skycomm.planner.route.RouteTemporalProjector;
import com.skycomm.planner.route.RouteWaypoint;
import com.skycomm.planner.rules.ResolvedRefuelingWindow;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places refueling windows on the time axis from their start and end waypoint names.
 */
public class RefuelingWindowResolver {
  private static final Logger log = LoggerFactory.getLogger(RefuelingWindowResolver.class);

  /**
   * Resolves each window. Windows referencing unknown waypoints, or ending before they start, are
   * skipped.
   */
  public List<ResolvedRefuelingWindow> resolve(
      List<RefuelingWindow> windows, ParsedRoute route, RouteTemporalProjector projector) {
    List<ResolvedRefuelingWindow> resolved = new ArrayList<>();
    for (RefuelingWindow window : windows) {
      Optional<Instant> start = timeAt(route, projector, window.startWaypointName());
      Optional<Instant> end = timeAt(route, projector, window.endWaypointName());
      if (start.isEmpty() || end.isEmpty()) {
        log.warn("Skipping refueling window {}: waypoint {} or {} not found on route {}",
            window.id(), window.startWaypointName(), window.endWaypointName(), route.id());
        continue;
      }
      if (end.get().isBefore(start.get())) {
        log.warn("Skipping refueling window {}: end {} precedes start {}",
            window.id(), end.get(), start.get());
        continue;
      }
      resolved.add(new ResolvedRefuelingWindow(
          window.id(), window.startWaypointName(), window.endWaypointName(), start.get(), end.get()));
    }
    return resolved;
  }

  private static Optional<Instant> timeAt(ParsedRoute route, RouteTemporalProjector projector, String name) {
    return route.findWaypoint(name).map(waypoint -> timeOf(waypoint, projector));
  }

  private static Instant timeOf(RouteWaypoint waypoint, RouteTemporalProjector projector) {
    if (waypoint.expectedArrivalTime() != null) {
      return waypoint.expectedArrivalTime();
    }
    return projector.project(waypoint.latitude(), waypoint.longitude()).timestamp();
  }
}
