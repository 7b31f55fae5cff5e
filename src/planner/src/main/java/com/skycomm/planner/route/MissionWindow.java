package com.skycomm.planner.route;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed time range covered by a mission timeline.
 */
public record MissionWindow(Instant start, Instant end) {

  public MissionWindow {
    if (start == null || end == null) {
      throw new ConfigurationException("Mission window requires a start and an end");
    }
    if (!end.isAfter(start)) {
      throw new ConfigurationException(
          "Mission window end " + end + " must be after start " + start);
    }
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  public Instant clamp(Instant instant) {
    if (instant.isBefore(start)) {
      return start;
    }
    return instant.isAfter(end) ? end : instant;
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && !instant.isAfter(end);
  }
}
