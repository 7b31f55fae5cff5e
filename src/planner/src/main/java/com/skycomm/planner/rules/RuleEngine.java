package com.skycomm.planner.rules;

import com.skycomm.planner.mission.ManualOutage;
import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.route.MissionWindow;
import com.skycomm.planner.route.RouteSample;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates mission events for one timeline build.
 *
 * <p>An engine is created per build and is not thread-safe. Events keep their insertion order for
 * equal timestamps.
 */
public class RuleEngine {
  private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);
  private static final DateTimeFormatter ZULU_TIME =
      DateTimeFormatter.ofPattern("HH:mm'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

  static final String TAKEOFF_KEY = "takeoff_buffer";
  static final String LANDING_KEY = "landing_buffer";
  static final String AZIMUTH_KEY = "x_azimuth";

  private final ConstraintConfig constraints;
  private final MissionWindow window;
  private final List<MissionEvent> events = new ArrayList<>();
  private final List<ResolvedRefuelingWindow> refuelingWindows = new ArrayList<>();

  public RuleEngine(ConstraintConfig constraints, MissionWindow window) {
    this.constraints = constraints;
    this.window = window;
  }

  public ConstraintConfig constraints() {
    return constraints;
  }

  public List<ResolvedRefuelingWindow> refuelingWindows() {
    return List.copyOf(refuelingWindows);
  }

  /**
   * Adds takeoff and landing safety windows on all three transports.
   */
  public void addSafetyBuffers(Instant departure, Instant arrival) {
    for (Transport transport : Transport.values()) {
      if (departure != null) {
        add(MissionEvent.of(departure, EventType.TAKEOFF_BUFFER_START, transport, Severity.SAFETY,
            "Safety-of-Flight (takeoff)", null, TAKEOFF_KEY, Map.of()));
        add(MissionEvent.of(departure.plus(constraints.takeoffBuffer()), EventType.TAKEOFF_BUFFER_END,
            transport, Severity.INFO, "Takeoff window complete", null, TAKEOFF_KEY, Map.of()));
      }
      if (arrival != null) {
        add(MissionEvent.of(arrival.minus(constraints.landingBuffer()), EventType.LANDING_BUFFER_START,
            transport, Severity.SAFETY, "Safety-of-Flight (landing)", null, LANDING_KEY, Map.of()));
        add(MissionEvent.of(arrival, EventType.LANDING_BUFFER_END, transport, Severity.INFO,
            "Landing window complete", null, LANDING_KEY, Map.of()));
      }
    }
  }

  /**
   * Registers a refueling window. It switches the X antenna to the refueling exclusion arc during
   * {@link #applyAzimuthSweep} and is marked on the timeline.
   */
  public void addRefuelingWindow(ResolvedRefuelingWindow refueling) {
    refuelingWindows.add(refueling);
    String key = "refueling:" + refueling.id();
    Map<String, String> metadata = Map.of("refueling_id", refueling.id());
    add(MissionEvent.of(refueling.start(), EventType.REFUELING_START, Transport.X, Severity.SAFETY,
        "AAR Start", null, key, metadata));
    add(MissionEvent.of(refueling.end(), EventType.REFUELING_END, Transport.X, Severity.INFO,
        "AAR End", null, key, metadata));
  }

  /**
   * Degrades X for the transition buffer on both sides of a satellite switch.
   */
  public void addXTransition(String transitionId, Instant at, String targetSatelliteId, boolean sameSatellite) {
    String key = "x_transition:" + transitionId;
    String label = sameSatellite
        ? "X beam switch on " + targetSatelliteId
        : "X Transition to " + targetSatelliteId;
    Map<String, String> metadata = Map.of(
        "transition_id", transitionId,
        "same_satellite", Boolean.toString(sameSatellite));
    add(MissionEvent.of(at.minus(constraints.transitionBuffer()), EventType.X_TRANSITION_START,
        Transport.X, Severity.WARNING, label, targetSatelliteId, key, metadata));
    add(MissionEvent.of(at.plus(constraints.transitionBuffer()), EventType.X_TRANSITION_END,
        Transport.X, Severity.INFO, label + " complete", targetSatelliteId, key, metadata));
  }

  /**
   * Degrades Ka for the transition buffer around a swap midpoint.
   */
  public void addKaTransition(String transitionId, String fromSatellite, String toSatellite, Instant midpoint) {
    String key = "ka_transition:" + transitionId;
    Map<String, String> metadata = Map.of(
        "transition_id", transitionId,
        "from_satellite", fromSatellite,
        "to_satellite", toSatellite);
    String label = "Ka Transition " + fromSatellite + " → " + toSatellite;
    add(MissionEvent.of(midpoint.minus(constraints.transitionBuffer()), EventType.KA_TRANSITION_START,
        Transport.KA, Severity.WARNING, label, toSatellite, key, metadata));
    add(MissionEvent.of(midpoint.plus(constraints.transitionBuffer()), EventType.KA_TRANSITION_END,
        Transport.KA, Severity.INFO, label + " complete", toSatellite, key, metadata));
  }

  /**
   * Degrades Ka while no satellite covers the route.
   *
   * @param gapId gap identifier
   * @param start coverage loss time
   * @param end coverage regain time, {@code null} when coverage does not return
   * @param lostSatellite last covering satellite, may be {@code null}
   * @param regainedSatellite first covering satellite after the gap, may be {@code null}
   */
  public void addKaCoverageGap(
      String gapId, Instant start, Instant end, String lostSatellite, String regainedSatellite) {
    String key = "ka_no_coverage:" + gapId;
    Map<String, String> metadata = Map.of("gap_id", gapId);
    add(MissionEvent.of(start, EventType.KA_COVERAGE_EXIT, Transport.KA, Severity.WARNING,
        "Ka coverage lost" + suffix(lostSatellite), lostSatellite, key, metadata));
    if (end != null) {
      add(MissionEvent.of(end, EventType.KA_COVERAGE_ENTRY, Transport.KA, Severity.INFO,
          "Ka coverage restored" + suffix(regainedSatellite), regainedSatellite, key, metadata));
    }
  }

  /**
   * Takes Ka or Ku offline for an operator-declared window.
   */
  public void addManualOutage(Transport transport, ManualOutage outage) {
    if (transport == Transport.X) {
      throw new IllegalArgumentException("Manual outages apply to Ka and Ku only");
    }
    boolean ka = transport == Transport.KA;
    String key = (ka ? "ka_outage:" : "ku_outage:") + outage.id();
    String reason = outage.reason() == null || outage.reason().isBlank()
        ? transport.label() + " outage"
        : outage.reason();
    Map<String, String> metadata = Map.of("outage_id", outage.id());
    add(MissionEvent.of(outage.start(), ka ? EventType.KA_OUTAGE_START : EventType.KU_OUTAGE_START,
        transport, Severity.WARNING, reason, null, key, metadata));
    add(MissionEvent.of(outage.end(), ka ? EventType.KA_OUTAGE_END : EventType.KU_OUTAGE_END,
        transport, Severity.INFO, transport.label() + " outage resolved", null, key, metadata));
  }

  /**
   * Sweeps the samples and records X line-of-sight state changes.
   *
   * <p>Each sample is checked against the satellite assigned at its time. Samples whose satellite
   * longitude cannot be resolved are skipped. A violation still open after the last sample is
   * closed at mission end.
   *
   * @param samples chronologically ordered samples
   * @param schedule X satellite assignments, in any order
   * @param longitudeResolver satellite id to fixed longitude
   */
  public void applyAzimuthSweep(
      List<RouteSample> samples,
      List<SatelliteAssignment> schedule,
      Function<String, Optional<Double>> longitudeResolver) {
    List<SatelliteAssignment> ordered = schedule.stream()
        .sorted(Comparator.comparing(SatelliteAssignment::effectiveFrom))
        .toList();
    if (ordered.isEmpty()) {
      log.debug("No X satellite assignment, skipping azimuth sweep");
      return;
    }

    int cursor = 0;
    ViolationReason active = ViolationReason.NONE;
    String activeSatellite = null;
    for (RouteSample sample : samples) {
      if (sample.timestamp().isBefore(ordered.get(0).effectiveFrom())) {
        continue;
      }
      while (cursor + 1 < ordered.size()
          && !ordered.get(cursor + 1).effectiveFrom().isAfter(sample.timestamp())) {
        cursor++;
      }
      String satelliteId = ordered.get(cursor).satelliteId();
      Optional<Double> satelliteLongitude = longitudeResolver.apply(satelliteId);
      if (satelliteLongitude.isEmpty()) {
        continue;
      }

      boolean refueling = inRefuelingWindow(sample.timestamp());
      AzimuthEvaluation evaluation = constraints.evaluate(
          sample.latitude(), sample.longitude(), sample.altitudeMeters(),
          sample.headingDegrees(), satelliteLongitude.get(), refueling);

      if (evaluation.violated()) {
        if (evaluation.reason() != active || !satelliteId.equals(activeSatellite)) {
          add(violationEvent(sample.timestamp(), satelliteId, evaluation));
          active = evaluation.reason();
          activeSatellite = satelliteId;
        }
      } else if (active != ViolationReason.NONE) {
        add(clearEvent(sample.timestamp(), satelliteId, "X azimuth clear"));
        active = ViolationReason.NONE;
        activeSatellite = null;
      }
    }
    if (active != ViolationReason.NONE) {
      add(clearEvent(window.end(), activeSatellite, "X azimuth clear (mission end)"));
    }
  }

  /**
   * Events ordered by timestamp; equal timestamps keep insertion order.
   */
  public List<MissionEvent> sortedEvents() {
    List<MissionEvent> sorted = new ArrayList<>(events);
    sorted.sort(Comparator.comparing(MissionEvent::timestamp));
    return List.copyOf(sorted);
  }

  /**
   * Pairs each transition start with the next transition end on the same transport and satellite.
   * Starts without a matching end produce no advisory.
   */
  public List<Advisory> generateAdvisories() {
    List<MissionEvent> sorted = sortedEvents();
    List<Advisory> advisories = new ArrayList<>();
    for (int i = 0; i < sorted.size(); i++) {
      MissionEvent start = sorted.get(i);
      if (!start.type().isTransitionStart()) {
        continue;
      }
      findTransitionEnd(sorted, i, start).ifPresent(end -> advisories.add(new Advisory(
          start.transport(),
          start.satelliteId(),
          start.timestamp(),
          end.timestamp(),
          String.format("Disable %s from %s to %s during transition to %s",
              start.transport().label(),
              ZULU_TIME.format(start.timestamp()),
              ZULU_TIME.format(end.timestamp()),
              start.satelliteId()))));
    }
    return advisories;
  }

  private static Optional<MissionEvent> findTransitionEnd(
      List<MissionEvent> sorted, int startIndex, MissionEvent start) {
    for (int j = startIndex + 1; j < sorted.size(); j++) {
      MissionEvent candidate = sorted.get(j);
      if (candidate.type().isTransitionEnd()
          && candidate.transport() == start.transport()
          && candidate.satelliteId() != null
          && candidate.satelliteId().equals(start.satelliteId())) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private boolean inRefuelingWindow(Instant timestamp) {
    for (ResolvedRefuelingWindow refueling : refuelingWindows) {
      if (refueling.contains(timestamp)) {
        return true;
      }
    }
    return false;
  }

  private MissionEvent violationEvent(Instant timestamp, String satelliteId, AzimuthEvaluation evaluation) {
    String reason = switch (evaluation.reason()) {
      case ELEVATION_BELOW_MINIMUM -> String.format(Locale.ROOT,
          "X line-of-sight blocked (%s, elevation %.1f° < min %.1f°)",
          satelliteId, evaluation.elevation(), constraints.minimumElevation());
      case AFT_CONE -> String.format(Locale.ROOT, "X-Ku Conflict az=%.1f° el=%.1f°",
          evaluation.testedAzimuth(), evaluation.elevation());
      case REFUELING_CONE -> String.format(Locale.ROOT, "X-AAR Conflict az=%.1f° el=%.1f°",
          evaluation.testedAzimuth(), evaluation.elevation());
      case NONE -> throw new IllegalStateException("No violation to report");
    };
    Map<String, String> metadata = Map.of(
        "violation", evaluation.reason().name(),
        "azimuth", String.format(Locale.ROOT, "%.2f", evaluation.absoluteAzimuth()),
        "elevation", String.format(Locale.ROOT, "%.2f", evaluation.elevation()));
    return new MissionEvent(
        timestamp,
        EventType.X_AZIMUTH_VIOLATION,
        Transport.X,
        Transport.X,
        Severity.WARNING,
        reason,
        satelliteId,
        AZIMUTH_KEY,
        evaluation.reason() == ViolationReason.AFT_CONE,
        metadata);
  }

  private static MissionEvent clearEvent(Instant timestamp, String satelliteId, String reason) {
    return MissionEvent.of(timestamp, EventType.X_AZIMUTH_CLEAR, Transport.X, Severity.INFO,
        reason, satelliteId, AZIMUTH_KEY, Map.of());
  }

  private void add(MissionEvent event) {
    events.add(event);
  }

  private static String suffix(String satelliteId) {
    return satelliteId == null ? "" : " (" + satelliteId + ")";
  }
}
