package com.skycomm.planner.eta;

import com.skycomm.planner.config.PlannerProperties;
import com.skycomm.planner.flight.EtaMode;
import com.skycomm.planner.flight.FlightPhase;
import com.skycomm.planner.geo.GeoMath;
import com.skycomm.planner.poi.Poi;
import com.skycomm.planner.route.ParsedRoute;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Distance and ETA for points of interest.
 *
 * <p>Route-aware estimates come from {@link RouteEtaEstimator}; when it has no answer, or fails,
 * the ETA falls back to straight-line distance over the current (or default) speed. POIs once
 * passed stay passed for the life of the calculator.
 */
@Component
public class EtaCalculator {
  /** ETA value meaning "unknown". */
  public static final double UNKNOWN_ETA = -1.0;

  private static final Logger log = LoggerFactory.getLogger(EtaCalculator.class);

  private final Clock clock;
  private final double defaultSpeedKnots;
  private final double passedThresholdMeters;
  private final Duration smoothingWindow;
  private final Set<String> passedPoiIds = ConcurrentHashMap.newKeySet();
  private final Deque<SpeedReading> speedHistory = new ArrayDeque<>();

  private record SpeedReading(Instant at, double knots) {}

  public EtaCalculator(PlannerProperties properties, Clock clock) {
    this.clock = clock;
    this.defaultSpeedKnots = properties.getEta().getDefaultSpeedKnots();
    this.passedThresholdMeters = properties.getEta().getPassedThresholdMeters();
    this.smoothingWindow = properties.getEta().getSpeedSmoothingWindow();
  }

  public static double haversineDistance(double lat1, double lon1, double lat2, double lon2) {
    return GeoMath.haversineMeters(lat1, lon1, lat2, lon2);
  }

  /**
   * Time to cover a distance at a speed.
   *
   * @return seconds, or {@link #UNKNOWN_ETA} when the speed is below half a knot
   */
  public static double calculateEta(double distanceMeters, double speedKnots) {
    if (!(speedKnots >= RouteEtaEstimator.MIN_USABLE_SPEED_KNOTS)) {
      return UNKNOWN_ETA;
    }
    double nauticalMiles = distanceMeters / GeoMath.METERS_PER_NAUTICAL_MILE;
    return nauticalMiles / speedKnots * 3600.0;
  }

  /**
   * Records a speed reading for smoothing. Non-finite or negative readings are dropped.
   */
  public void updateSpeed(double speedKnots) {
    if (!Double.isFinite(speedKnots) || speedKnots < 0) {
      return;
    }
    Instant now = clock.instant();
    synchronized (speedHistory) {
      speedHistory.addLast(new SpeedReading(now, speedKnots));
      evictOlderThan(now.minus(smoothingWindow));
    }
  }

  /** Mean speed over the smoothing window. */
  public OptionalDouble smoothedSpeed() {
    synchronized (speedHistory) {
      evictOlderThan(clock.instant().minus(smoothingWindow));
      return speedHistory.stream().mapToDouble(SpeedReading::knots).average();
    }
  }

  public boolean isPassed(String poiId) {
    return passedPoiIds.contains(poiId);
  }

  /**
   * Computes metrics for every POI, in input order.
   *
   * @param latitude aircraft latitude
   * @param longitude aircraft longitude
   * @param pois POIs to evaluate
   * @param speedKnots current speed, {@code null} to use the smoothed or default speed; a speed
   *     below half a knot gives {@link #UNKNOWN_ETA} for straight-line estimates
   * @param activeRoute active route, {@code null} for straight-line estimates only
   * @param etaMode ETA mode from the flight state
   * @param flightPhase flight phase from the flight state
   */
  public List<PoiMetrics> calculatePoiMetrics(
      double latitude,
      double longitude,
      List<Poi> pois,
      Double speedKnots,
      ParsedRoute activeRoute,
      EtaMode etaMode,
      FlightPhase flightPhase) {
    double speed = effectiveSpeed(speedKnots);
    Instant now = clock.instant();
    List<PoiMetrics> metrics = new ArrayList<>(pois.size());
    for (Poi poi : pois) {
      double distance = haversineDistance(latitude, longitude, poi.latitude(), poi.longitude());
      if (distance <= passedThresholdMeters && poi.id() != null) {
        passedPoiIds.add(poi.id());
      }
      double eta = routeAwareEta(poi, activeRoute, etaMode, latitude, longitude, speed, now)
          .orElseGet(() -> calculateEta(distance, speed));
      metrics.add(new PoiMetrics(
          poi.id(),
          poi.name(),
          poi.category(),
          distance,
          eta,
          etaMode,
          poi.id() != null && passedPoiIds.contains(poi.id()),
          flightPhase,
          flightPhase == FlightPhase.PRE_DEPARTURE));
    }
    return metrics;
  }

  private OptionalDouble routeAwareEta(
      Poi poi,
      ParsedRoute route,
      EtaMode mode,
      double latitude,
      double longitude,
      double speed,
      Instant now) {
    if (route == null || (poi.routeId() != null && !poi.routeId().equals(route.id()))) {
      return OptionalDouble.empty();
    }
    try {
      return mode == EtaMode.ANTICIPATED
          ? RouteEtaEstimator.anticipated(route, poi, now)
          : RouteEtaEstimator.estimated(route, poi, latitude, longitude, speed);
    } catch (RuntimeException ex) {
      log.debug("Route-aware ETA failed for POI {}, using straight-line estimate: {}",
          poi.id(), ex.getMessage());
      return OptionalDouble.empty();
    }
  }

  private double effectiveSpeed(Double speedKnots) {
    if (speedKnots != null) {
      return speedKnots;
    }
    OptionalDouble smoothed = smoothedSpeed();
    if (smoothed.isPresent() && smoothed.getAsDouble() > RouteEtaEstimator.MIN_USABLE_SPEED_KNOTS) {
      return smoothed.getAsDouble();
    }
    return defaultSpeedKnots;
  }

  private void evictOlderThan(Instant cutoff) {
    while (!speedHistory.isEmpty() && speedHistory.peekFirst().at().isBefore(cutoff)) {
      speedHistory.removeFirst();
    }
  }
}
