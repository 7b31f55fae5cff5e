package com.skycomm.planner.route;

import com.skycomm.planner.geo.GeoMath;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places a parsed route on an absolute time axis and samples it.
 *
 * <p>Points carrying a planned arrival time are used as anchors. Between two anchors, segments with
 * a planned speed take {@code length / speed}; the remaining time is spread over the other segments
 * in proportion to their length. The first and last points fall back to the mission window bounds.
 *
 * <p>Instances are immutable once built and can be shared across threads.
 */
public class RouteTemporalProjector {
  public static final double DEFAULT_CRUISE_ALTITUDE_METERS = 10_668.0;
  public static final int DEFAULT_SAMPLE_INTERVAL_SECONDS = 60;

  private static final Logger log = LoggerFactory.getLogger(RouteTemporalProjector.class);

  private final ParsedRoute route;
  private final List<RoutePoint> points;
  private final MissionWindow window;
  private final double[] cumulativeMeters;
  private final double[] offsetSeconds;
  private final double totalMeters;

  /**
   * Builds a projector for the route.
   *
   * @param route route to project
   * @param windowOverride explicit mission window, or {@code null} to derive it from the route
   * @throws ConfigurationException when the route is empty or no window can be derived
   */
  public RouteTemporalProjector(ParsedRoute route, MissionWindow windowOverride) {
    if (route == null || route.id() == null || route.id().isBlank()) {
      throw new ConfigurationException("Route identifier is required");
    }
    if (route.points().isEmpty()) {
      throw new ConfigurationException("Route " + route.id() + " has no points");
    }
    this.route = route;
    this.points = route.points();
    this.window = windowOverride != null ? windowOverride : deriveWindow(route);
    this.cumulativeMeters = cumulativeDistances(points);
    this.totalMeters = Math.max(cumulativeMeters[cumulativeMeters.length - 1], 1.0);
    this.offsetSeconds = pointOffsets();
  }

  /**
   * Derives the mission window from the timing profile and the point timestamps.
   */
  public static MissionWindow deriveWindow(ParsedRoute route) {
    List<Instant> candidates = new ArrayList<>();
    if (route.timing().departureTime() != null) {
      candidates.add(route.timing().departureTime());
    }
    if (route.timing().arrivalTime() != null) {
      candidates.add(route.timing().arrivalTime());
    }
    for (RoutePoint point : route.points()) {
      if (point.expectedArrivalTime() != null) {
        candidates.add(point.expectedArrivalTime());
      }
    }
    if (candidates.isEmpty()) {
      throw new ConfigurationException(
          "Route " + route.id() + " has no timing data and no mission window was supplied");
    }
    Instant start = candidates.stream().min(Instant::compareTo).orElseThrow();
    Instant end = candidates.stream().max(Instant::compareTo).orElseThrow();
    return new MissionWindow(start, end);
  }

  public ParsedRoute route() {
    return route;
  }

  public MissionWindow window() {
    return window;
  }

  public double totalDistanceMeters() {
    return totalMeters;
  }

  /**
   * Position at an absolute time; times outside the window are clamped to it.
   */
  public RouteSample positionAtTime(Instant timestamp) {
    Instant clamped = window.clamp(timestamp);
    double seconds = secondsFromStart(clamped);
    int last = points.size() - 1;
    if (last == 0 || seconds <= offsetSeconds[0]) {
      return sampleOnSegment(clamped, 0, 0.0);
    }
    if (seconds >= offsetSeconds[last]) {
      return sampleOnSegment(clamped, last - 1, 1.0);
    }
    int segment = segmentForOffset(seconds);
    double span = offsetSeconds[segment + 1] - offsetSeconds[segment];
    double ratio = span <= 0 ? 1.0 : (seconds - offsetSeconds[segment]) / span;
    return sampleOnSegment(clamped, segment, ratio);
  }

  /**
   * Route position at a given distance flown, with the time the aircraft is expected there.
   */
  public RouteSample sampleAtDistance(double distanceMeters) {
    double target = Math.max(0.0, Math.min(distanceMeters, cumulativeMeters[points.size() - 1]));
    if (points.size() == 1) {
      return sampleOnSegment(window.start(), 0, 0.0);
    }
    int segment = segmentForDistance(target);
    double length = cumulativeMeters[segment + 1] - cumulativeMeters[segment];
    double ratio = length <= 0 ? 0.0 : (target - cumulativeMeters[segment]) / length;
    double seconds = offsetSeconds[segment]
        + (offsetSeconds[segment + 1] - offsetSeconds[segment]) * ratio;
    return sampleOnSegment(atOffset(seconds), segment, ratio);
  }

  public Instant timeAtDistance(double distanceMeters) {
    return sampleAtDistance(distanceMeters).timestamp();
  }

  /**
   * Projects an arbitrary location onto the nearest point of the route.
   */
  public RouteProjection project(double latitude, double longitude) {
    if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
      throw new ConfigurationException("Cannot project non-finite location " + latitude + "," + longitude);
    }
    if (points.size() == 1) {
      RoutePoint only = points.get(0);
      double off = GeoMath.haversineMeters(latitude, longitude, only.latitude(), only.longitude());
      return new RouteProjection(only.latitude(), only.longitude(), 0.0, 0, off, window.start());
    }
    int bestSegment = 0;
    double bestRatio = 0.0;
    double bestDistance = Double.MAX_VALUE;
    for (int i = 0; i < points.size() - 1; i++) {
      double ratio = closestRatio(points.get(i), points.get(i + 1), latitude, longitude);
      RoutePoint from = points.get(i);
      RoutePoint to = points.get(i + 1);
      double lat = from.latitude() + (to.latitude() - from.latitude()) * ratio;
      double lon = GeoMath.interpolateLongitude(from.longitude(), to.longitude(), ratio);
      double distance = GeoMath.haversineMeters(latitude, longitude, lat, lon);
      if (distance < bestDistance) {
        bestDistance = distance;
        bestSegment = i;
        bestRatio = ratio;
      }
    }
    double along = cumulativeMeters[bestSegment]
        + (cumulativeMeters[bestSegment + 1] - cumulativeMeters[bestSegment]) * bestRatio;
    RouteSample position = sampleAtDistance(along);
    return new RouteProjection(
        position.latitude(),
        position.longitude(),
        along,
        bestSegment,
        bestDistance,
        position.timestamp());
  }

  /**
   * Generates uniformly spaced samples across the mission window. The last sample always sits on
   * the window end.
   *
   * @param intervalSeconds spacing; non-positive values fall back to 60 s
   * @param coverage coverage lookup attached to every sample, or {@code null}
   */
  public List<RouteSample> generateSamples(int intervalSeconds, CoverageLookup coverage) {
    int interval = intervalSeconds > 0 ? intervalSeconds : DEFAULT_SAMPLE_INTERVAL_SECONDS;
    long durationSeconds = Math.max(window.duration().getSeconds(), 1);
    List<RouteSample> samples = new ArrayList<>();
    for (long offset = 0; offset < durationSeconds; offset += interval) {
      samples.add(withCoverage(positionAtTime(window.start().plusSeconds(offset)), coverage));
    }
    samples.add(withCoverage(positionAtTime(window.end()), coverage));
    backfillHeadings(samples);
    log.debug("Generated {} samples for route {} at {}s", samples.size(), route.id(), interval);
    return samples;
  }

  private RouteSample withCoverage(RouteSample sample, CoverageLookup coverage) {
    if (coverage == null) {
      return sample;
    }
    Set<String> covering = coverage.coverageAt(sample.latitude(), sample.longitude());
    return sample.withCoverage(covering);
  }

  private static void backfillHeadings(List<RouteSample> samples) {
    Double last = null;
    for (int i = 0; i < samples.size(); i++) {
      RouteSample sample = samples.get(i);
      if (sample.headingDegrees() != null) {
        last = sample.headingDegrees();
      } else if (last != null) {
        samples.set(i, sample.withHeading(last));
      }
    }
    Double next = null;
    for (int i = samples.size() - 1; i >= 0; i--) {
      RouteSample sample = samples.get(i);
      if (sample.headingDegrees() != null) {
        next = sample.headingDegrees();
      } else if (next != null) {
        samples.set(i, sample.withHeading(next));
      }
    }
  }

  private RouteSample sampleOnSegment(Instant timestamp, int segment, double ratio) {
    RoutePoint from = points.get(segment);
    if (points.size() == 1) {
      return new RouteSample(timestamp, from.latitude(), from.longitude(),
          altitudeOf(from, from, 0.0), null, 0.0, Set.of());
    }
    RoutePoint to = points.get(segment + 1);
    double lat = from.latitude() + (to.latitude() - from.latitude()) * ratio;
    double lon = GeoMath.interpolateLongitude(from.longitude(), to.longitude(), ratio);
    double length = cumulativeMeters[segment + 1] - cumulativeMeters[segment];
    Double heading = length > 0
        ? GeoMath.initialBearing(from.latitude(), from.longitude(), to.latitude(), to.longitude())
        : null;
    double along = cumulativeMeters[segment] + length * ratio;
    return new RouteSample(timestamp, lat, lon, altitudeOf(from, to, ratio), heading, along, Set.of());
  }

  private static double altitudeOf(RoutePoint from, RoutePoint to, double ratio) {
    Double a = from.altitudeMeters();
    Double b = to.altitudeMeters();
    if (a != null && b != null) {
      return a + (b - a) * ratio;
    }
    if (a != null) {
      return a;
    }
    return b != null ? b : DEFAULT_CRUISE_ALTITUDE_METERS;
  }

  private static double closestRatio(RoutePoint from, RoutePoint to, double latitude, double longitude) {
    // Local equirectangular frame centred on the segment start.
    double cosLat = Math.cos(Math.toRadians(from.latitude()));
    double segX = wrapDelta(to.longitude() - from.longitude()) * cosLat;
    double segY = to.latitude() - from.latitude();
    double ptX = wrapDelta(longitude - from.longitude()) * cosLat;
    double ptY = latitude - from.latitude();
    double lengthSquared = segX * segX + segY * segY;
    if (lengthSquared == 0) {
      return 0.0;
    }
    double ratio = (ptX * segX + ptY * segY) / lengthSquared;
    return Math.max(0.0, Math.min(1.0, ratio));
  }

  private static double wrapDelta(double delta) {
    return GeoMath.normalizeLongitude(delta);
  }

  private int segmentForOffset(double seconds) {
    int low = 0;
    int high = points.size() - 2;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (offsetSeconds[mid] <= seconds) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    return low;
  }

  private int segmentForDistance(double meters) {
    int low = 0;
    int high = points.size() - 2;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (cumulativeMeters[mid] <= meters) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    return low;
  }

  private double secondsFromStart(Instant instant) {
    return Duration.between(window.start(), instant).toMillis() / 1000.0;
  }

  private Instant atOffset(double seconds) {
    return window.start().plusMillis(Math.round(seconds * 1000.0));
  }

  private static double[] cumulativeDistances(List<RoutePoint> points) {
    double[] cumulative = new double[points.size()];
    for (int i = 1; i < points.size(); i++) {
      RoutePoint a = points.get(i - 1);
      RoutePoint b = points.get(i);
      cumulative[i] = cumulative[i - 1]
          + GeoMath.haversineMeters(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }
    return cumulative;
  }

  private double[] pointOffsets() {
    int n = points.size();
    double duration = secondsFromStart(window.end());
    double[] offsets = new double[n];
    List<Integer> anchors = new ArrayList<>();
    anchors.add(0);
    offsets[0] = anchorOffset(points.get(0), 0.0, duration);
    for (int i = 1; i < n - 1; i++) {
      RoutePoint point = points.get(i);
      if (point.expectedArrivalTime() == null) {
        continue;
      }
      double offset = anchorOffset(point, 0.0, duration);
      if (offset > offsets[anchors.get(anchors.size() - 1)]) {
        offsets[i] = offset;
        anchors.add(i);
      } else {
        log.debug("Ignoring out-of-order timestamp on route {} point {}", route.id(), i);
      }
    }
    if (n > 1) {
      double lastOffset = anchorOffset(points.get(n - 1), duration, duration);
      offsets[n - 1] = Math.max(lastOffset, offsets[anchors.get(anchors.size() - 1)]);
      anchors.add(n - 1);
    }
    for (int a = 0; a < anchors.size() - 1; a++) {
      distribute(offsets, anchors.get(a), anchors.get(a + 1));
    }
    return offsets;
  }

  private double anchorOffset(RoutePoint point, double fallback, double duration) {
    if (point.expectedArrivalTime() == null) {
      return fallback;
    }
    double offset = secondsFromStart(point.expectedArrivalTime());
    return Math.max(0.0, Math.min(duration, offset));
  }

  private void distribute(double[] offsets, int from, int to) {
    double span = offsets[to] - offsets[from];
    double planned = 0.0;
    double freeMeters = 0.0;
    double[] plannedSeconds = new double[to - from];
    for (int i = from; i < to; i++) {
      double length = cumulativeMeters[i + 1] - cumulativeMeters[i];
      Double speed = points.get(i).expectedSegmentSpeedKnots();
      if (speed != null && speed > 0) {
        plannedSeconds[i - from] = length / GeoMath.knotsToMetersPerSecond(speed);
        planned += plannedSeconds[i - from];
      } else {
        plannedSeconds[i - from] = -1.0;
        freeMeters += length;
      }
    }

    double freeRate = freeMeters > 0 && planned < span ? (span - planned) / freeMeters : 0.0;
    double plannedScale = 1.0;
    if (planned > 0 && (freeMeters <= 0 || planned >= span)) {
      plannedScale = span / planned;
    }
    double segmentMeters = cumulativeMeters[to] - cumulativeMeters[from];
    for (int i = from; i < to; i++) {
      double length = cumulativeMeters[i + 1] - cumulativeMeters[i];
      double seconds;
      if (plannedSeconds[i - from] >= 0) {
        seconds = plannedSeconds[i - from] * plannedScale;
      } else if (freeRate > 0) {
        seconds = length * freeRate;
      } else if (planned <= 0 && segmentMeters > 0) {
        seconds = span * length / segmentMeters;
      } else if (planned <= 0) {
        seconds = span / (to - from);
      } else {
        seconds = 0.0;
      }
      offsets[i + 1] = offsets[i] + seconds;
    }
    offsets[to] = offsets[from] + span;
  }
}
