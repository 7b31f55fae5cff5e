package com.skycomm.planner.eta;

import com.skycomm.planner.geo.GeoMath;
import com.skycomm.planner.poi.Poi;
import com.skycomm.planner.poi.PoiProjection;
import com.skycomm.planner.route.ParsedRoute;
import com.skycomm.planner.route.RoutePoint;
import com.skycomm.planner.route.RouteWaypoint;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Route-aware ETA estimates. Every method is pure and returns empty when the route cannot
 * answer; the caller decides the fallback.
 */
public final class RouteEtaEstimator {
  static final double SEGMENT_TOLERANCE_METERS = 1000.0;
  static final double MIN_USABLE_SPEED_KNOTS = 0.5;

  private RouteEtaEstimator() {}

  /**
   * ETA from planned times, before departure.
   *
   * <p>The POI is matched to a waypoint by name, else to the planned time of the route point
   * nearest its projection. A planned time already in the past yields {@link EtaCalculator#UNKNOWN_ETA}.
   */
  public static OptionalDouble anticipated(ParsedRoute route, Poi poi, Instant now) {
    if (!route.hasTimingData()) {
      return OptionalDouble.empty();
    }
    Optional<Instant> planned = route.findWaypoint(poi.name())
        .map(RouteWaypoint::expectedArrivalTime)
        .or(() -> poi.routeProjection()
            .map(PoiProjection::routePointIndex)
            .filter(index -> index >= 0 && index < route.points().size())
            .map(index -> route.points().get(index).expectedArrivalTime()));
    if (planned.isEmpty()) {
      return OptionalDouble.empty();
    }
    double seconds = Duration.between(now, planned.get()).toMillis() / 1000.0;
    return OptionalDouble.of(seconds < 0 ? EtaCalculator.UNKNOWN_ETA : seconds);
  }

  /**
   * ETA from live progress: walks the route from the nearest route point to the POI.
   *
   * <p>The leg in progress flies at the mean of live and planned speed; later legs at their
   * planned speed, or live speed when none is planned. Off-route POIs stop at their projection
   * on the first segment within {@value #SEGMENT_TOLERANCE_METERS} m of it.
   */
  public static OptionalDouble estimated(
      ParsedRoute route, Poi poi, double latitude, double longitude, double liveSpeedKnots) {
    List<RoutePoint> points = route.points();
    if (points.size() < 2) {
      return OptionalDouble.empty();
    }
    int nearest = nearestPointIndex(points, latitude, longitude);

    int lastSegment;
    double targetLat;
    double targetLon;
    Optional<RouteWaypoint> waypoint = route.findWaypoint(poi.name());
    if (waypoint.isPresent()) {
      targetLat = waypoint.get().latitude();
      targetLon = waypoint.get().longitude();
      lastSegment = nearestPointIndex(points, targetLat, targetLon) - 1;
    } else if (poi.routeProjection().isPresent()) {
      PoiProjection projection = poi.routeProjection().get();
      targetLat = projection.latitude();
      targetLon = projection.longitude();
      OptionalInt segment = findContainingSegment(points, targetLat, targetLon, SEGMENT_TOLERANCE_METERS);
      if (segment.isPresent()) {
        lastSegment = segment.getAsInt();
      } else if (projection.routePointIndex() != null) {
        lastSegment = projection.routePointIndex() - 1;
      } else {
        return OptionalDouble.empty();
      }
    } else {
      int index = nearestPointIndex(points, poi.latitude(), poi.longitude());
      RoutePoint point = points.get(index);
      if (GeoMath.haversineMeters(poi.latitude(), poi.longitude(), point.latitude(), point.longitude())
          > SEGMENT_TOLERANCE_METERS) {
        return OptionalDouble.empty();
      }
      targetLat = point.latitude();
      targetLon = point.longitude();
      lastSegment = index - 1;
    }
    if (lastSegment < nearest) {
      return OptionalDouble.empty();
    }

    double seconds = 0.0;
    double fromLat = latitude;
    double fromLon = longitude;
    for (int i = nearest; i <= lastSegment && i < points.size() - 1; i++) {
      RoutePoint next = points.get(i + 1);
      boolean finalLeg = i == lastSegment;
      double toLat = finalLeg ? targetLat : next.latitude();
      double toLon = finalLeg ? targetLon : next.longitude();
      double speed = i == nearest
          ? currentLegSpeed(liveSpeedKnots, points.get(i).expectedSegmentSpeedKnots())
          : futureLegSpeed(liveSpeedKnots, points.get(i).expectedSegmentSpeedKnots());
      double meters = GeoMath.haversineMeters(fromLat, fromLon, toLat, toLon);
      if (speed > MIN_USABLE_SPEED_KNOTS) {
        seconds += meters / GeoMath.knotsToMetersPerSecond(speed);
      }
      fromLat = toLat;
      fromLon = toLon;
    }
    return seconds > 0 ? OptionalDouble.of(seconds) : OptionalDouble.empty();
  }

  /**
   * Index of the first segment passing within {@code toleranceMeters} of the location.
   */
  public static OptionalInt findContainingSegment(
      List<RoutePoint> points, double latitude, double longitude, double toleranceMeters) {
    for (int i = 0; i < points.size() - 1; i++) {
      if (distanceToSegment(points.get(i), points.get(i + 1), latitude, longitude) <= toleranceMeters) {
        return OptionalInt.of(i);
      }
    }
    return OptionalInt.empty();
  }

  /**
   * Distance from a location to a segment, from the triangle formed with the segment ends.
   */
  static double distanceToSegment(RoutePoint start, RoutePoint end, double latitude, double longitude) {
    double a = GeoMath.haversineMeters(latitude, longitude, start.latitude(), start.longitude());
    double b = GeoMath.haversineMeters(latitude, longitude, end.latitude(), end.longitude());
    double c = GeoMath.haversineMeters(start.latitude(), start.longitude(), end.latitude(), end.longitude());
    if (c == 0) {
      return a;
    }
    if (b * b > a * a + c * c) {
      return a;
    }
    if (a * a > b * b + c * c) {
      return b;
    }
    double s = (a + b + c) / 2.0;
    double area = Math.sqrt(Math.max(0.0, s * (s - a) * (s - b) * (s - c)));
    return 2.0 * area / c;
  }

  static int nearestPointIndex(List<RoutePoint> points, double latitude, double longitude) {
    int best = 0;
    double bestDistance = Double.MAX_VALUE;
    for (int i = 0; i < points.size(); i++) {
      RoutePoint point = points.get(i);
      double distance = GeoMath.haversineMeters(latitude, longitude, point.latitude(), point.longitude());
      if (distance < bestDistance) {
        bestDistance = distance;
        best = i;
      }
    }
    return best;
  }

  private static double currentLegSpeed(double live, Double planned) {
    boolean liveUsable = live > MIN_USABLE_SPEED_KNOTS;
    if (planned != null && planned > MIN_USABLE_SPEED_KNOTS) {
      return liveUsable ? (live + planned) / 2.0 : planned;
    }
    return live;
  }

  private static double futureLegSpeed(double live, Double planned) {
    return planned != null && planned > MIN_USABLE_SPEED_KNOTS ? planned : live;
  }
}
