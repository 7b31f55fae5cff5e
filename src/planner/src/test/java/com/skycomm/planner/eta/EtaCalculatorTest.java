package com.skycomm.planner.eta;

import static com.skycomm.planner.TestFixtures.ARRIVAL;
import static com.skycomm.planner.TestFixtures.DEPARTURE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.skycomm.planner.MutableClock;
import com.skycomm.planner.config.PlannerProperties;
import com.skycomm.planner.flight.EtaMode;
import com.skycomm.planner.flight.FlightPhase;
import com.skycomm.planner.poi.Poi;
import com.skycomm.planner.route.ParsedRoute;
import com.skycomm.planner.route.RoutePoint;
import com.skycomm.planner.route.RouteTimingProfile;
import com.skycomm.planner.route.RouteWaypoint;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EtaCalculatorTest {
  private MutableClock clock;
  private EtaCalculator calculator;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(DEPARTURE.minus(Duration.ofMinutes(30)));
    calculator = new EtaCalculator(new PlannerProperties(), clock);
  }

  @Test
  void etaIsDistanceOverSpeed() {
    assertEquals(3600.0, EtaCalculator.calculateEta(1852.0, 1.0), 1e-9);
    assertEquals(60.0, EtaCalculator.calculateEta(7408.0, 240.0), 1e-9);
  }

  @Test
  void etaIsUnknownWithoutUsableSpeed() {
    assertEquals(EtaCalculator.UNKNOWN_ETA, EtaCalculator.calculateEta(10_000.0, 0.0));
    assertEquals(EtaCalculator.UNKNOWN_ETA, EtaCalculator.calculateEta(10_000.0, -5.0));
    assertEquals(EtaCalculator.UNKNOWN_ETA, EtaCalculator.calculateEta(10_000.0, 0.4));
    assertEquals(EtaCalculator.UNKNOWN_ETA, EtaCalculator.calculateEta(10_000.0, Double.NaN));
  }

  @Test
  void haversineDistanceMatchesKnownValue() {
    assertThat(EtaCalculator.haversineDistance(48.8566, 2.3522, 40.7128, -74.0060))
        .isCloseTo(5_837_000.0, within(10_000.0));
  }

  @Test
  void smoothedSpeedAveragesRecentReadings() {
    calculator.updateSpeed(100.0);
    clock.advanceSeconds(60);
    calculator.updateSpeed(200.0);
    calculator.updateSpeed(Double.NaN);
    calculator.updateSpeed(-10.0);

    assertEquals(150.0, calculator.smoothedSpeed().getAsDouble(), 1e-9);

    clock.advanceSeconds(90);
    assertEquals(200.0, calculator.smoothedSpeed().getAsDouble(), 1e-9);

    clock.advanceSeconds(60);
    assertTrue(calculator.smoothedSpeed().isEmpty());
  }

  @Test
  void straightLineEstimateUsesDefaultSpeedWithoutReadings() {
    Poi poi = Poi.global("p1", "Tower", 0.0, 1.0);

    PoiMetrics metrics = calculator.calculatePoiMetrics(
        0.0, 0.0, List.of(poi), null, null, EtaMode.ESTIMATED, FlightPhase.IN_FLIGHT).get(0);

    double distance = EtaCalculator.haversineDistance(0.0, 0.0, 0.0, 1.0);
    assertEquals(distance, metrics.distanceMeters(), 1e-6);
    assertEquals(EtaCalculator.calculateEta(distance, 150.0), metrics.etaSeconds(), 1e-6);
    assertTrue(metrics.hasEta());
    assertFalse(metrics.preDeparture());
    assertEquals(EtaMode.ESTIMATED, metrics.etaType());
  }

  @Test
  void smoothedSpeedIsUsedWhenLiveSpeedIsMissing() {
    calculator.updateSpeed(300.0);
    Poi poi = Poi.global("p1", "Tower", 0.0, 1.0);

    PoiMetrics metrics = calculator.calculatePoiMetrics(
        0.0, 0.0, List.of(poi), null, null, EtaMode.ESTIMATED, FlightPhase.IN_FLIGHT).get(0);

    assertEquals(EtaCalculator.calculateEta(metrics.distanceMeters(), 300.0), metrics.etaSeconds(), 1e-6);
  }

  @Test
  void stationaryAircraftHasUnknownStraightLineEta() {
    calculator.updateSpeed(300.0);
    Poi poi = Poi.global("p1", "Tower", 41.0, -30.0);

    PoiMetrics metrics = calculator.calculatePoiMetrics(
        40.0, -30.0, List.of(poi), 0.0, null, EtaMode.ANTICIPATED, FlightPhase.PRE_DEPARTURE).get(0);

    assertEquals(EtaCalculator.UNKNOWN_ETA, metrics.etaSeconds());
    assertFalse(metrics.hasEta());
    assertThat(metrics.distanceMeters()).isGreaterThan(100_000.0);
  }

  @Test
  void passedPoiStaysPassed() {
    Poi poi = Poi.global("p1", "Tower", 0.0, 0.0005);

    PoiMetrics near = calculator.calculatePoiMetrics(
        0.0, 0.0, List.of(poi), 200.0, null, EtaMode.ESTIMATED, FlightPhase.IN_FLIGHT).get(0);
    PoiMetrics later = calculator.calculatePoiMetrics(
        0.0, 0.5, List.of(poi), 200.0, null, EtaMode.ESTIMATED, FlightPhase.IN_FLIGHT).get(0);

    assertTrue(near.passed());
    assertTrue(later.passed());
    assertTrue(calculator.isPassed("p1"));
  }

  @Test
  void anticipatedModeUsesRoutePlanBeforeDeparture() {
    Poi waypointPoi = new Poi("p2", "MID", 0.0, 1.0, "waypoint", "R1", null);

    PoiMetrics metrics = calculator.calculatePoiMetrics(0.0, 0.0, List.of(waypointPoi), null, route(),
        EtaMode.ANTICIPATED, FlightPhase.PRE_DEPARTURE).get(0);

    assertEquals(5400.0, metrics.etaSeconds(), 1e-9);
    assertTrue(metrics.preDeparture());
    assertEquals(FlightPhase.PRE_DEPARTURE, metrics.flightPhase());
  }

  @Test
  void poiOfAnotherRouteGetsStraightLineEstimate() {
    Poi foreign = new Poi("p3", "MID", 0.0, 1.0, "waypoint", "OTHER", null);

    PoiMetrics metrics = calculator.calculatePoiMetrics(0.0, 0.0, List.of(foreign), 150.0, route(),
        EtaMode.ANTICIPATED, FlightPhase.PRE_DEPARTURE).get(0);

    assertEquals(EtaCalculator.calculateEta(metrics.distanceMeters(), 150.0), metrics.etaSeconds(), 1e-6);
  }

  @Test
  void metricsFollowInputOrder() {
    List<Poi> pois = List.of(
        Poi.global("b", "Bravo", 0.0, 2.0),
        Poi.global("a", "Alpha", 0.0, 1.0));

    List<PoiMetrics> metrics = calculator.calculatePoiMetrics(
        0.0, 0.0, pois, 150.0, null, EtaMode.ESTIMATED, FlightPhase.IN_FLIGHT);

    assertThat(metrics).extracting(PoiMetrics::poiId).containsExactly("b", "a");
  }

  private static ParsedRoute route() {
    return new ParsedRoute("R1", "planned", List.of(
        new RoutePoint(0, 0, null, 0, DEPARTURE, null),
        new RoutePoint(0, 1, null, 1, null, null),
        new RoutePoint(0, 2, null, 2, ARRIVAL, null)),
        List.of(new RouteWaypoint("MID", 0, 1, 1, "waypoint", DEPARTURE.plus(Duration.ofHours(1)))),
        new RouteTimingProfile(DEPARTURE, ARRIVAL));
  }
}
