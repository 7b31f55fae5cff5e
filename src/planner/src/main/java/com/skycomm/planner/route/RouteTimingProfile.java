package com.skycomm.planner.route;

import java.time.Instant;

public record RouteTimingProfile(Instant departureTime, Instant arrivalTime) {
  public static final RouteTimingProfile NONE = new RouteTimingProfile(null, null);

  public boolean hasTimingData() {
    return departureTime != null || arrivalTime != null;
  }
}
