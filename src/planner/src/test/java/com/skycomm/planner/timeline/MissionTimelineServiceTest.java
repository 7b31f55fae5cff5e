package com.skycomm.planner.timeline;

import static com.skycomm.planner.TestFixtures.ARRIVAL;
import static com.skycomm.planner.TestFixtures.DEPARTURE;
import static com.skycomm.planner.TestFixtures.rectangle;
import static com.skycomm.planner.TestFixtures.route;
import static com.skycomm.planner.TestFixtures.sampler;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.skycomm.planner.config.PlannerProperties;
import com.skycomm.planner.coverage.CoverageSampler;
import com.skycomm.planner.mission.ManualOutage;
import com.skycomm.planner.mission.MissionConfig;
import com.skycomm.planner.mission.RefuelingWindow;
import com.skycomm.planner.mission.TimelineStatus;
import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.mission.TransportConfig;
import com.skycomm.planner.mission.TransportState;
import com.skycomm.planner.mission.XTransition;
import com.skycomm.planner.poi.Poi;
import com.skycomm.planner.poi.PoiSource;
import com.skycomm.planner.route.ConfigurationException;
import com.skycomm.planner.route.MissionWindow;
import com.skycomm.planner.route.ParsedRoute;
import com.skycomm.planner.route.RoutePoint;
import com.skycomm.planner.route.RouteWaypoint;
import com.skycomm.planner.rules.Advisory;
import com.skycomm.planner.rules.EventType;
import com.skycomm.planner.rules.MissionEvent;
import com.skycomm.planner.satellite.InMemorySatelliteCatalog;
import com.skycomm.planner.satellite.Satellite;
import com.skycomm.planner.satellite.SatelliteCatalog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MissionTimelineServiceTest {
  private static final SatelliteCatalog CATALOG =
      new InMemorySatelliteCatalog(List.of(new Satellite("X-1", Transport.X, -30.0, null)));

  private PlannerProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private MissionTimelineService service;

  @BeforeEach
  void setUp() {
    properties = new PlannerProperties();
    meterRegistry = new SimpleMeterRegistry();
    service = service(CATALOG);
  }

  @Test
  void clearMissionYieldsNominalSegmentsSplitBySafetyWindows() {
    MissionTimelineResult result = build(mission("M1", "X-1"), southbound(), Optional.empty());

    List<TimelineSegment> segments = result.timeline().segments();
    assertThat(segments).hasSize(3);
    assertThat(segments).extracting(TimelineSegment::status).containsOnly(TimelineStatus.NOMINAL);
    assertThat(segments).extracting(TimelineSegment::safetyWindow).containsExactly(true, false, true);
    assertEquals(DEPARTURE.plus(Duration.ofMinutes(15)), segments.get(0).end());
    assertEquals(ARRIVAL.minus(Duration.ofMinutes(15)), segments.get(2).start());
    assertThat(segments.get(0).reasons()).contains("Safety-of-Flight (takeoff)");

    TimelineSummary summary = result.summary();
    assertEquals(7200.0, summary.totalSeconds(), 1e-9);
    assertEquals(0.0, summary.degradedSeconds(), 1e-9);
    assertEquals(-1.0, summary.nextConflictSeconds(), 1e-9);
    assertEquals(121, summary.sampleCount());
    assertThat(summary.worstStates()).containsValues(TransportState.AVAILABLE);
    assertEquals(1.0, meterRegistry.counter("planner.timeline.builds", "outcome", "success").count());
  }

  @Test
  void expectedAftConflictIsDowngradedToNominal() {
    MissionTimelineResult result = build(mission("M2", "X-1"), northbound(), Optional.empty());

    List<TimelineSegment> segments = result.timeline().segments();
    assertThat(segments).extracting(TimelineSegment::status).containsOnly(TimelineStatus.NOMINAL);
    assertThat(segments).allSatisfy(segment -> {
      assertThat(segment.expectedConflictDowngrade()).isTrue();
      assertEquals(TransportState.DEGRADED, segment.stateOf(Transport.X));
      assertThat(segment.reasons()).anySatisfy(reason -> assertThat(reason).startsWith("X-Ku Conflict"));
    });
    assertEquals(0.0, result.summary().degradedSeconds(), 1e-9);
    assertEquals(TransportState.DEGRADED, result.summary().worstStates().get(Transport.X));
  }

  @Test
  void elevationFloorDegradesX() {
    properties.getConstraints().setMinimumElevation(60.0);

    MissionTimelineResult result = build(mission("M3", "X-1"), southbound(), Optional.empty());

    assertThat(result.timeline().segments()).extracting(TimelineSegment::status)
        .containsOnly(TimelineStatus.DEGRADED);
    assertThat(result.timeline().segments().get(0).reasons())
        .anySatisfy(reason -> assertThat(reason).startsWith("X line-of-sight blocked (X-1"));
    assertEquals(0.0, result.summary().nextConflictSeconds(), 1e-9);
  }

  @Test
  void refuelingWindowAppliesForwardExclusionArc() {
    ParsedRoute route = route("R-AAR", DEPARTURE, ARRIVAL, List.of(
        new RouteWaypoint("ARCP", 37.5, -30.0, 1, "waypoint", null),
        new RouteWaypoint("ARCX", 32.5, -30.0, 2, "waypoint", null)),
        40.0, -30.0, 30.0, -30.0);
    TransportConfig transports = new TransportConfig("X-1", List.of(), List.of(), List.of(),
        List.of(new RefuelingWindow("aar-1", "arcp", "ARCX")));

    MissionTimeline timeline = build(new MissionConfig("M4", "AAR", transports), route, Optional.empty()).timeline();

    assertThat(timeline.refuelingBlocks()).hasSize(1);
    assertEquals(DEPARTURE.plus(Duration.ofMinutes(30)), timeline.refuelingBlocks().get(0).start());
    assertThat(timeline.markers()).extracting(MissionMarker::type).contains(
        MissionMarker.MarkerType.REFUELING_START, MissionMarker.MarkerType.REFUELING_END);
    assertThat(timeline.segments())
        .filteredOn(segment -> segment.status() == TimelineStatus.DEGRADED)
        .isNotEmpty()
        .allSatisfy(segment -> assertThat(segment.reasons())
            .anySatisfy(reason -> assertThat(reason).startsWith("X-AAR Conflict")));
  }

  @Test
  void xTransitionProducesAdvisoryAndMarker() {
    TransportConfig transports = new TransportConfig("X-1",
        List.of(new XTransition("t1", 35.0, -30.0, "X-1", false)), List.of(), List.of(), List.of());

    MissionTimeline timeline =
        build(new MissionConfig("M5", "transition", transports), southbound(), Optional.empty()).timeline();

    assertThat(timeline.advisories()).extracting(Advisory::message)
        .containsExactly("Disable X from 10:45Z to 11:15Z during transition to X-1");
    assertThat(timeline.markers()).extracting(MissionMarker::type)
        .containsExactly(MissionMarker.MarkerType.X_TRANSITION);
    assertThat(timeline.segments())
        .filteredOn(segment -> segment.status() == TimelineStatus.DEGRADED)
        .extracting(TimelineSegment::duration)
        .containsExactly(Duration.ofMinutes(30));
  }

  @Test
  void kaCoverageGapDegradesKa() {
    CoverageSampler sampler = sampler(
        "AOR", rectangle(-40, -20, -12, 20),
        "IOR", rectangle(12, -20, 40, 20));
    ParsedRoute route = route("R-EQ", DEPARTURE, ARRIVAL, 0, -30, 0, 30);

    MissionTimelineResult result = build(mission("M6", null), route, Optional.of(sampler));

    assertThat(result.timeline().events()).extracting(MissionEvent::type)
        .contains(EventType.KA_COVERAGE_EXIT, EventType.KA_COVERAGE_ENTRY);
    assertThat(result.timeline().markers()).extracting(MissionMarker::type)
        .containsExactly(MissionMarker.MarkerType.KA_GAP_START, MissionMarker.MarkerType.KA_GAP_END);
    assertEquals(TransportState.DEGRADED, result.summary().worstStates().get(Transport.KA));
    assertThat(result.timeline().segments())
        .filteredOn(segment -> segment.stateOf(Transport.KA) == TransportState.DEGRADED)
        .singleElement()
        .satisfies(segment -> assertThat(segment.reasons()).contains("Ka coverage lost (AOR)"));
  }

  @Test
  void manualOutagesTakeTransportsOffline() {
    TransportConfig transports = new TransportConfig("X-1", List.of(),
        List.of(new ManualOutage("ka-1", DEPARTURE.plus(Duration.ofMinutes(30)), Duration.ofMinutes(30), "Gateway")),
        List.of(new ManualOutage("ku-1", DEPARTURE.plus(Duration.ofMinutes(45)), Duration.ofMinutes(30), null)),
        List.of());

    MissionTimeline timeline =
        build(new MissionConfig("M7", "outages", transports), southbound(), Optional.empty()).timeline();

    assertThat(timeline.segments()).extracting(TimelineSegment::status).contains(TimelineStatus.CRITICAL);
    TimelineSegment critical = timeline.segments().stream()
        .filter(segment -> segment.status() == TimelineStatus.CRITICAL)
        .findFirst()
        .orElseThrow();
    assertEquals(DEPARTURE.plus(Duration.ofMinutes(45)), critical.start());
    assertEquals(DEPARTURE.plus(Duration.ofMinutes(60)), critical.end());
    assertThat(critical.impactedTransports()).containsExactly(Transport.KA, Transport.KU);
    assertEquals(1800.0, timeline.statistics().nextConflictSeconds(), 1e-9);
  }

  @Test
  void unknownSatelliteSkipsAzimuthChecks() {
    MissionTimeline timeline = build(mission("M8", "X-9"), northbound(), Optional.empty()).timeline();

    assertThat(timeline.events()).extracting(MissionEvent::type)
        .doesNotContain(EventType.X_AZIMUTH_VIOLATION);
    assertThat(timeline.segments()).hasSize(3);
  }

  @Test
  void satelliteLongitudeFallsBackToGlobalPoi() {
    PoiSource pois = () -> List.of(Poi.global("poi-1", "x-2", 0.0, -30.0));

    MissionTimeline timeline = service.buildMissionTimeline(
        mission("M9", "X-2"), northbound(), Optional.empty(), Optional.of(pois)).timeline();

    assertThat(timeline.events()).extracting(MissionEvent::type).contains(EventType.X_AZIMUTH_VIOLATION);
  }

  @Test
  void explicitWindowAllowsRouteWithoutTiming() {
    ParsedRoute untimed = new ParsedRoute("R-NT", "untimed",
        List.of(RoutePoint.of(40.0, -30.0, 0), RoutePoint.of(30.0, -30.0, 1)), List.of(), null);
    MissionConfig mission = new MissionConfig("M10", "window", TransportConfig.singleSatellite("X-1"),
        new MissionWindow(DEPARTURE, ARRIVAL));

    MissionTimeline timeline = build(mission, untimed, Optional.empty()).timeline();

    assertEquals(DEPARTURE, timeline.window().start());
    assertThat(timeline.segments()).hasSize(3);
  }

  @Test
  void routeWithoutTimingIsAConfigurationError() {
    ParsedRoute untimed = new ParsedRoute("R-NT", "untimed",
        List.of(RoutePoint.of(40.0, -30.0, 0), RoutePoint.of(30.0, -30.0, 1)), List.of(), null);

    assertThrows(ConfigurationException.class,
        () -> build(mission("M11", "X-1"), untimed, Optional.empty()));
    assertEquals(1.0, meterRegistry.counter("planner.timeline.builds", "outcome", "config_error").count());
  }

  @Test
  void unexpectedFailureIsWrapped() {
    SatelliteCatalog broken = mock(SatelliteCatalog.class);
    when(broken.longitudeOf(anyString())).thenThrow(new IllegalStateException("catalog down"));

    TimelineComputationException ex = assertThrows(TimelineComputationException.class,
        () -> service(broken).buildMissionTimeline(
            mission("M12", "X-1"), southbound(), Optional.empty(), Optional.empty()));

    assertThat(ex.getCause()).isInstanceOf(IllegalStateException.class);
    assertEquals(1.0, meterRegistry.counter("planner.timeline.builds", "outcome", "failure").count());
  }

  private MissionTimelineService service(SatelliteCatalog catalog) {
    return new MissionTimelineService(properties, catalog, Optional.empty(), Optional.empty(), meterRegistry);
  }

  private MissionTimelineResult build(MissionConfig mission, ParsedRoute route, Optional<CoverageSampler> sampler) {
    return service.buildMissionTimeline(mission, route, sampler, Optional.empty());
  }

  private static MissionConfig mission(String id, String xSatellite) {
    return new MissionConfig(id, id + " mission", TransportConfig.singleSatellite(xSatellite));
  }

  private static ParsedRoute southbound() {
    return route("R-S", DEPARTURE, ARRIVAL, 40.0, -30.0, 30.0, -30.0);
  }

  private static ParsedRoute northbound() {
    return route("R-N", DEPARTURE, ARRIVAL, 30.0, -30.0, 40.0, -30.0);
  }
}
