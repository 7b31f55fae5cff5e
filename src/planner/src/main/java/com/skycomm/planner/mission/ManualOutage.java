package com.skycomm.planner.mission;

import java.time.Duration;
import java.time.Instant;

/**
 * Operator-declared outage window on the Ka or Ku transport.
 *
 * @param id outage identifier, unique per transport
 * @param start outage start
 * @param duration outage length
 * @param reason free text shown on the timeline; a default is used when blank
 */
public record ManualOutage(String id, Instant start, Duration duration, String reason) {
  public Instant end() {
    return start.plus(duration);
  }
}
