package com.skycomm.planner.timeline;

import com.skycomm.planner.mission.TimelineStatus;
import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.mission.TransportState;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Half-open slice of the mission window with constant transport states.
 *
 * @param id segment identifier, {@code <mission>-segment-NNN}
 * @param start inclusive start
 * @param end exclusive end
 * @param status aggregate status
 * @param transportStates state of every transport
 * @param reasons de-duplicated reasons across transports
 * @param impactedTransports transports that are not available
 * @param safetyWindow true inside a takeoff or landing safety window
 * @param expectedConflictDowngrade true when the segment was reported nominal because its only
 *     impact is an expected X/Ku aft conflict
 */
public record TimelineSegment(
    String id,
    Instant start,
    Instant end,
    TimelineStatus status,
    Map<Transport, TransportState> transportStates,
    List<String> reasons,
    List<Transport> impactedTransports,
    boolean safetyWindow,
    boolean expectedConflictDowngrade) {

  public TimelineSegment {
    transportStates = Map.copyOf(transportStates);
    reasons = List.copyOf(reasons);
    impactedTransports = List.copyOf(impactedTransports);
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  public TransportState stateOf(Transport transport) {
    return transportStates.getOrDefault(transport, TransportState.AVAILABLE);
  }
}
