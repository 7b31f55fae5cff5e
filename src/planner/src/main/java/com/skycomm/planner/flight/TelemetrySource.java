package com.skycomm.planner.flight;

import java.util.Optional;

/** Provider of the latest live telemetry. Acquisition itself lives outside this service. */
public interface TelemetrySource {
  Optional<TelemetrySample> latest();
}
