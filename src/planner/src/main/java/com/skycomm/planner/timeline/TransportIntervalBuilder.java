package com.skycomm.planner.timeline;

import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.mission.TransportState;
import com.skycomm.planner.route.MissionWindow;
import com.skycomm.planner.rules.EventCategory.ConditionKind;
import com.skycomm.planner.rules.MissionEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the sorted event stream into a partition of the mission window for one transport.
 *
 * <p>Opening events activate a condition under their key, closing events remove it. The transport
 * is offline while an outage condition is open, degraded while any other adverse condition is
 * open, and available otherwise. Safety conditions only contribute reasons. Events before the
 * window are clamped to its start; events at or after its end are ignored.
 */
public class TransportIntervalBuilder {

  private record Condition(ConditionKind kind, String reason, boolean expectedConflict) {}

  public List<TransportInterval> build(List<MissionEvent> sortedEvents, Transport transport, MissionWindow window) {
    Map<String, Condition> open = new LinkedHashMap<>();
    List<TransportInterval> closed = new ArrayList<>();
    TransportInterval current = snapshot(transport, window.start(), window.end(), open);

    for (MissionEvent event : sortedEvents) {
      if (event.affectedTransport() != transport) {
        continue;
      }
      ConditionKind kind = event.type().category().conditionKind();
      if (kind == ConditionKind.MARKER) {
        continue;
      }
      Instant at = event.timestamp().isBefore(window.start()) ? window.start() : event.timestamp();
      if (!at.isBefore(window.end())) {
        break;
      }

      if (event.type().opening()) {
        open.put(event.conditionKey(), new Condition(kind, event.reason(), event.expectedConflict()));
      } else {
        open.remove(event.conditionKey());
      }

      TransportInterval next = snapshot(transport, at, window.end(), open);
      if (next.sameStateAs(current)) {
        continue;
      }
      if (current.start().isBefore(at)) {
        closed.add(current.withEnd(at));
      }
      TransportInterval previous = closed.isEmpty() ? null : closed.get(closed.size() - 1);
      if (previous != null && previous.end().equals(at) && previous.sameStateAs(next)) {
        closed.remove(closed.size() - 1);
        next = next.withStart(previous.start());
      }
      current = next;
    }
    closed.add(current.withEnd(window.end()));
    return List.copyOf(closed);
  }

  private static TransportInterval snapshot(
      Transport transport, Instant start, Instant end, Map<String, Condition> open) {
    boolean offline = false;
    boolean degraded = false;
    boolean safety = false;
    boolean allExpected = true;
    Set<String> reasons = new LinkedHashSet<>();
    for (Condition condition : open.values()) {
      switch (condition.kind()) {
        case OFFLINE -> {
          offline = true;
          allExpected = false;
        }
        case DEGRADED -> {
          degraded = true;
          allExpected &= condition.expectedConflict();
        }
        case SAFETY -> safety = true;
        default -> {
          continue;
        }
      }
      if (condition.reason() != null && !condition.reason().isBlank()) {
        reasons.add(condition.reason());
      }
    }
    TransportState state = offline
        ? TransportState.OFFLINE
        : degraded ? TransportState.DEGRADED : TransportState.AVAILABLE;
    boolean expectedOnly = state == TransportState.DEGRADED && allExpected;
    return new TransportInterval(transport, start, end, state, new ArrayList<>(reasons), safety, expectedOnly);
  }
}
