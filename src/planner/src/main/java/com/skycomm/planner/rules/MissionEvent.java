package com.skycomm.planner.rules;

import com.skycomm.planner.mission.Transport;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable event produced by the rule engine.
 *
 * @param timestamp event time
 * @param type tagged event type
 * @param transport transport that raised the event
 * @param affectedTransport transport whose state the event changes
 * @param severity severity shown to operators
 * @param reason human-readable reason
 * @param satelliteId satellite concerned, {@code null} when not applicable
 * @param conditionKey key pairing opening and closing events of the same condition
 * @param expectedConflict true for an X aft-cone conflict with the Ku antenna, which is expected
 *     geometry rather than a fault
 * @param metadata extra attributes such as transition or outage ids
 */
public record MissionEvent(
    Instant timestamp,
    EventType type,
    Transport transport,
    Transport affectedTransport,
    Severity severity,
    String reason,
    String satelliteId,
    String conditionKey,
    boolean expectedConflict,
    Map<String, String> metadata) {

  public MissionEvent {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static MissionEvent of(
      Instant timestamp,
      EventType type,
      Transport transport,
      Severity severity,
      String reason,
      String satelliteId,
      String conditionKey,
      Map<String, String> metadata) {
    return new MissionEvent(
        timestamp, type, transport, transport, severity, reason, satelliteId, conditionKey, false, metadata);
  }
}
