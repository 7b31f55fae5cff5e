package com.skycomm.planner.timeline;

import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.mission.TransportState;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Half-open interval of constant state for one transport.
 *
 * @param transport transport described
 * @param start inclusive start
 * @param end exclusive end
 * @param state transport state
 * @param reasons reasons of the open conditions, in activation order
 * @param safetyWindow true while a takeoff or landing safety window is open
 * @param expectedConflictOnly true when the state is degraded by expected X/Ku aft conflicts only
 */
public record TransportInterval(
    Transport transport,
    Instant start,
    Instant end,
    TransportState state,
    List<String> reasons,
    boolean safetyWindow,
    boolean expectedConflictOnly) {

  public TransportInterval {
    reasons = List.copyOf(reasons);
  }

  public boolean covers(Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  TransportInterval withStart(Instant newStart) {
    return new TransportInterval(transport, newStart, end, state, reasons, safetyWindow, expectedConflictOnly);
  }

  TransportInterval withEnd(Instant newEnd) {
    return new TransportInterval(transport, start, newEnd, state, reasons, safetyWindow, expectedConflictOnly);
  }

  boolean sameStateAs(TransportInterval other) {
    return state == other.state
        && reasons.equals(other.reasons)
        && safetyWindow == other.safetyWindow
        && expectedConflictOnly == other.expectedConflictOnly;
  }
}
