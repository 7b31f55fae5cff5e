package com.skycomm.planner.flight;

import static com.skycomm.planner.TestFixtures.ARRIVAL;
import static com.skycomm.planner.TestFixtures.DEPARTURE;
import static com.skycomm.planner.TestFixtures.route;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.skycomm.planner.MutableClock;
import com.skycomm.planner.config.PlannerProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FlightStateManagerTest {
  private static final Instant T0 = DEPARTURE.minus(Duration.ofMinutes(30));

  private MutableClock clock;
  private FlightStateManager manager;
  private final List<String> transitions = new ArrayList<>();

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    manager = new FlightStateManager(new PlannerProperties(), clock);
    manager.addListener((previous, current, reason) -> transitions.add(previous + "->" + current));
  }

  @Test
  void departureRequiresSpeedToPersist() {
    for (int i = 0; i < 10; i++) {
      assertFalse(manager.checkDeparture(60.0));
      clock.advanceSeconds(1);
    }
    assertFalse(manager.checkDeparture(10.0));
    assertEquals(0.0, manager.getStatus().speedPersistenceSeconds(), 1e-9);

    int declared = 0;
    for (int i = 0; i <= 10; i++) {
      clock.advanceSeconds(1);
      if (manager.checkDeparture(60.0)) {
        declared++;
      }
    }

    assertEquals(1, declared);
    FlightStatus status = manager.getStatus();
    assertEquals(FlightPhase.IN_FLIGHT, status.phase());
    assertEquals(EtaMode.ESTIMATED, status.etaMode());
    assertEquals(T0.plusSeconds(21), status.departureTime());
    assertThat(transitions).containsExactly("PRE_DEPARTURE->IN_FLIGHT");
  }

  @Test
  void departureChecksAreIgnoredOnceInFlight() {
    manager.triggerDeparture(null, "manual");

    assertFalse(manager.checkDeparture(300.0));
    assertFalse(manager.checkDeparture(Double.NaN));
    assertEquals(T0, manager.getStatus().departureTime());
  }

  @Test
  void arrivalRequiresDwellWithinThreshold() {
    manager.triggerDeparture(T0, "manual");

    assertFalse(manager.checkArrival(50.0, 5.0));
    clock.advanceSeconds(30);
    assertFalse(manager.checkArrival(500.0, 40.0));
    assertEquals(0.0, manager.getStatus().arrivalDwellSeconds(), 1e-9);

    assertFalse(manager.checkArrival(80.0, 5.0));
    clock.advanceSeconds(59);
    assertFalse(manager.checkArrival(60.0, 2.0));
    clock.advanceSeconds(1);
    assertTrue(manager.checkArrival(40.0, 0.0));

    FlightStatus status = manager.getStatus();
    assertEquals(FlightPhase.POST_ARRIVAL, status.phase());
    assertEquals(clock.instant(), status.arrivalTime());
    assertFalse(manager.checkArrival(10.0, 0.0));
  }

  @Test
  void manualTransitionToPreDepartureClearsTimes() {
    manager.triggerDeparture(T0, "manual");
    manager.triggerArrival(T0.plusSeconds(3600), "manual");

    assertTrue(manager.transitionPhase(FlightPhase.PRE_DEPARTURE, "operator"));
    assertFalse(manager.transitionPhase(FlightPhase.PRE_DEPARTURE, "operator"));

    FlightStatus status = manager.getStatus();
    assertNull(status.departureTime());
    assertNull(status.arrivalTime());
    assertThat(transitions).containsExactly(
        "PRE_DEPARTURE->IN_FLIGHT", "IN_FLIGHT->POST_ARRIVAL", "POST_ARRIVAL->PRE_DEPARTURE");
  }

  @Test
  void manualTransitionToInFlightKeepsExistingDepartureTime() {
    manager.triggerArrival(T0.plusSeconds(60), "skip");

    assertTrue(manager.transitionPhase(FlightPhase.IN_FLIGHT, "go-around"));

    FlightStatus status = manager.getStatus();
    assertEquals(T0.plusSeconds(60), status.departureTime());
    assertNull(status.arrivalTime());
  }

  @Test
  void arrivalWithoutDepartureBackfillsDepartureTime() {
    FlightStatus status = manager.triggerArrival(null, "manual");

    assertEquals(T0, status.departureTime());
    assertEquals(T0, status.arrivalTime());
    assertEquals(FlightPhase.POST_ARRIVAL, status.phase());
  }

  @Test
  void routeChangeResetsFlightWhenRequested() {
    manager.updateRouteContext(route("R1", DEPARTURE, ARRIVAL, 0, 0, 0, 1), false, "startup");
    manager.triggerDeparture(null, "manual");

    manager.updateRouteContext(route("R1", DEPARTURE, ARRIVAL, 0, 0, 0, 1), true, "same route");
    assertEquals(FlightPhase.IN_FLIGHT, manager.currentPhase());

    FlightStatus status = manager.updateRouteContext(route("R2", DEPARTURE, ARRIVAL, 0, 0, 0, 2), true, "new route");

    assertEquals(FlightPhase.PRE_DEPARTURE, status.phase());
    assertEquals("R2", status.activeRouteId());
    assertTrue(status.hasTimingData());
    assertEquals(DEPARTURE, status.scheduledDepartureTime());
    assertEquals(1800L, status.timeUntilDepartureSeconds());
    assertNull(status.timeSinceDepartureSeconds());
    assertThat(manager.activeRoute()).isPresent();
  }

  @Test
  void routeChangeWithoutAutoResetKeepsPhase() {
    manager.triggerDeparture(null, "manual");

    manager.updateRouteContext(route("R1", DEPARTURE, ARRIVAL, 0, 0, 0, 1), false, "startup sync");

    assertEquals(FlightPhase.IN_FLIGHT, manager.currentPhase());
    assertEquals("R1", manager.getStatus().activeRouteId());
  }

  @Test
  void clearingRouteContextKeepsPhase() {
    manager.updateRouteContext(route("R1", DEPARTURE, ARRIVAL, 0, 0, 0, 1), false, "startup");
    manager.triggerDeparture(null, "manual");
    clock.advanceSeconds(90);

    FlightStatus status = manager.clearRouteContext();

    assertNull(status.activeRouteId());
    assertFalse(status.hasTimingData());
    assertEquals(FlightPhase.IN_FLIGHT, status.phase());
    assertEquals(0L, status.timeUntilDepartureSeconds());
    assertEquals(90L, status.timeSinceDepartureSeconds());
    assertThat(manager.activeRoute()).isEmpty();
  }

  @Test
  void failingListenerDoesNotBlockOthers() {
    List<FlightPhase> seen = new ArrayList<>();
    FlightStateManager isolated = new FlightStateManager(new PlannerProperties(), clock);
    isolated.addListener((previous, current, reason) -> {
      throw new IllegalStateException("listener failure");
    });
    isolated.addListener((previous, current, reason) -> seen.add(current));

    isolated.triggerDeparture(null, "manual");

    assertThat(seen).containsExactly(FlightPhase.IN_FLIGHT);
    assertEquals(FlightPhase.IN_FLIGHT, isolated.currentPhase());
  }

  @Test
  void resetReturnsToPreDeparture() {
    manager.triggerDeparture(null, "manual");

    FlightStatus status = manager.reset("operator");

    assertTrue(status.isPreDeparture());
    assertNull(status.departureTime());
    assertEquals(EtaMode.ANTICIPATED, status.etaMode());
  }
}
