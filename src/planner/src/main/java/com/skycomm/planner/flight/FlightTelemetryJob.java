package com.skycomm.planner.flight;

import com.skycomm.planner.eta.EtaCalculator;
import com.skycomm.planner.geo.GeoMath;
import com.skycomm.planner.route.ParsedRoute;
import com.skycomm.planner.route.RoutePoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic telemetry tick driving automatic departure and arrival detection.
 */
@Component
public class FlightTelemetryJob {
  private static final Logger log = LoggerFactory.getLogger(FlightTelemetryJob.class);

  private final Optional<TelemetrySource> telemetrySource;
  private final FlightStateManager flightStateManager;
  private final EtaCalculator etaCalculator;
  private final Counter processedCounter;
  private final Counter idleCounter;
  private final Counter errorCounter;

  public FlightTelemetryJob(
      Optional<TelemetrySource> telemetrySource,
      FlightStateManager flightStateManager,
      EtaCalculator etaCalculator,
      MeterRegistry meterRegistry) {
    this.telemetrySource = telemetrySource;
    this.flightStateManager = flightStateManager;
    this.etaCalculator = etaCalculator;
    this.processedCounter = meterRegistry.counter("planner.telemetry.ticks", "outcome", "processed");
    this.idleCounter = meterRegistry.counter("planner.telemetry.ticks", "outcome", "idle");
    this.errorCounter = meterRegistry.counter("planner.telemetry.ticks", "outcome", "error");
    if (telemetrySource.isEmpty()) {
      log.info("No telemetry source configured, automatic flight phase detection idle");
    }
  }

  @Scheduled(fixedDelayString = "${planner.flight-state.telemetry-tick-ms:1000}")
  public void tick() {
    try {
      Optional<TelemetrySample> latest = telemetrySource.flatMap(TelemetrySource::latest);
      if (latest.isEmpty()) {
        idleCounter.increment();
        return;
      }
      process(latest.get());
      processedCounter.increment();
    } catch (Exception ex) {
      // Keep the last known state and the scheduler running.
      errorCounter.increment();
      log.warn("Telemetry tick skipped: {}", ex.getMessage(), ex);
    }
  }

  private void process(TelemetrySample sample) {
    etaCalculator.updateSpeed(sample.speedKnots());
    FlightPhase phase = flightStateManager.currentPhase();
    if (phase == FlightPhase.PRE_DEPARTURE) {
      flightStateManager.checkDeparture(sample.speedKnots());
    } else if (phase == FlightPhase.IN_FLIGHT) {
      Optional<RoutePoint> destination = flightStateManager.activeRoute().flatMap(ParsedRoute::destination);
      if (destination.isEmpty()) {
        return;
      }
      double distance = GeoMath.haversineMeters(sample.latitude(), sample.longitude(),
          destination.get().latitude(), destination.get().longitude());
      flightStateManager.checkArrival(distance, sample.speedKnots());
    }
  }
}
