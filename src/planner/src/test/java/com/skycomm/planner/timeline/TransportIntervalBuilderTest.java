package com.skycomm.planner.timeline;

import static com.skycomm.planner.TestFixtures.ARRIVAL;
import static com.skycomm.planner.TestFixtures.DEPARTURE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.skycomm.planner.mission.ManualOutage;
import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.mission.TransportState;
import com.skycomm.planner.route.MissionWindow;
import com.skycomm.planner.rules.ConstraintConfig;
import com.skycomm.planner.rules.EventType;
import com.skycomm.planner.rules.MissionEvent;
import com.skycomm.planner.rules.ResolvedRefuelingWindow;
import com.skycomm.planner.rules.RuleEngine;
import com.skycomm.planner.rules.Severity;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TransportIntervalBuilderTest {
  private static final MissionWindow WINDOW = new MissionWindow(DEPARTURE, ARRIVAL);

  private final TransportIntervalBuilder builder = new TransportIntervalBuilder();
  private final RuleEngine engine = new RuleEngine(ConstraintConfig.defaults(), WINDOW);

  @Test
  void noEventsGivesSingleAvailableInterval() {
    List<TransportInterval> intervals = builder.build(List.of(), Transport.KU, WINDOW);

    assertThat(intervals).hasSize(1);
    assertEquals(TransportState.AVAILABLE, intervals.get(0).state());
    assertEquals(DEPARTURE, intervals.get(0).start());
    assertEquals(ARRIVAL, intervals.get(0).end());
  }

  @Test
  void safetyWindowsAddReasonsWithoutDegrading() {
    engine.addSafetyBuffers(DEPARTURE, ARRIVAL);

    List<TransportInterval> intervals = builder.build(engine.sortedEvents(), Transport.X, WINDOW);

    assertThat(intervals).extracting(TransportInterval::state).containsOnly(TransportState.AVAILABLE);
    assertThat(intervals).extracting(TransportInterval::safetyWindow).containsExactly(true, false, true);
    assertThat(intervals).extracting(TransportInterval::end)
        .containsExactly(minute(15), minute(105), ARRIVAL);
    assertThat(intervals.get(0).reasons()).containsExactly("Safety-of-Flight (takeoff)");
    assertThat(intervals.get(2).reasons()).containsExactly("Safety-of-Flight (landing)");
  }

  @Test
  void outageDominatesConcurrentDegradation() {
    engine.addKaTransition("AOR->IOR-0", "AOR", "IOR", minute(30));
    engine.addManualOutage(Transport.KA, new ManualOutage("o1", minute(20), Duration.ofMinutes(20), "Maintenance"));

    List<TransportInterval> intervals = builder.build(engine.sortedEvents(), Transport.KA, WINDOW);

    assertThat(intervals).extracting(TransportInterval::state).containsExactly(
        TransportState.AVAILABLE, TransportState.DEGRADED, TransportState.OFFLINE,
        TransportState.DEGRADED, TransportState.AVAILABLE);
    TransportInterval offline = intervals.get(2);
    assertEquals(minute(20), offline.start());
    assertEquals(minute(40), offline.end());
    assertThat(offline.reasons()).containsExactly("Ka Transition AOR → IOR", "Maintenance");
  }

  @Test
  void adjacentIntervalsWithSameStateAreMerged() {
    engine.addManualOutage(Transport.KU, new ManualOutage("o1", minute(10), Duration.ofMinutes(10), null));
    engine.addManualOutage(Transport.KU, new ManualOutage("o2", minute(20), Duration.ofMinutes(10), null));

    List<TransportInterval> intervals = builder.build(engine.sortedEvents(), Transport.KU, WINDOW);

    assertThat(intervals).hasSize(3);
    assertEquals(TransportState.OFFLINE, intervals.get(1).state());
    assertEquals(minute(10), intervals.get(1).start());
    assertEquals(minute(30), intervals.get(1).end());
  }

  @Test
  void eventsOutsideWindowAreClampedOrIgnored() {
    engine.addManualOutage(Transport.KU,
        new ManualOutage("early", DEPARTURE.minus(Duration.ofMinutes(10)), Duration.ofMinutes(20), null));
    engine.addManualOutage(Transport.KU,
        new ManualOutage("late", ARRIVAL.minus(Duration.ofMinutes(5)), Duration.ofMinutes(30), null));

    List<TransportInterval> intervals = builder.build(engine.sortedEvents(), Transport.KU, WINDOW);

    assertThat(intervals).extracting(TransportInterval::state).containsExactly(
        TransportState.OFFLINE, TransportState.AVAILABLE, TransportState.OFFLINE);
    assertEquals(DEPARTURE, intervals.get(0).start());
    assertEquals(minute(10), intervals.get(0).end());
    assertEquals(ARRIVAL, intervals.get(2).end());
  }

  @Test
  void refuelingMarkersDoNotChangeState() {
    engine.addRefuelingWindow(new ResolvedRefuelingWindow("aar", "A", "B", minute(30), minute(60)));

    assertThat(builder.build(engine.sortedEvents(), Transport.X, WINDOW)).hasSize(1);
  }

  @Test
  void expectedConflictFlagRequiresAllDegradationsToBeExpected() {
    List<MissionEvent> events = new ArrayList<>();
    events.add(new MissionEvent(minute(10), EventType.X_AZIMUTH_VIOLATION, Transport.X, Transport.X,
        Severity.WARNING, "X-Ku Conflict", "X-1", "x_azimuth", true, Map.of()));
    events.add(MissionEvent.of(minute(20), EventType.X_TRANSITION_START, Transport.X, Severity.WARNING,
        "X Transition to X-2", "X-2", "x_transition:t1", Map.of()));
    events.add(MissionEvent.of(minute(30), EventType.X_TRANSITION_END, Transport.X, Severity.INFO,
        "done", "X-2", "x_transition:t1", Map.of()));

    List<TransportInterval> intervals = builder.build(events, Transport.X, WINDOW);

    assertThat(intervals).extracting(TransportInterval::expectedConflictOnly)
        .containsExactly(false, true, false, true);
    assertThat(intervals).extracting(TransportInterval::state).containsExactly(
        TransportState.AVAILABLE, TransportState.DEGRADED, TransportState.DEGRADED, TransportState.DEGRADED);
  }

  private static Instant minute(int minutes) {
    return DEPARTURE.plus(Duration.ofMinutes(minutes));
  }
}
