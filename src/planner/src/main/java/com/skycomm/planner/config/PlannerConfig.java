package com.skycomm.planner.config;

import com.skycomm.planner.flight.FlightStateManager;
import com.skycomm.planner.satellite.InMemorySatelliteCatalog;
import com.skycomm.planner.satellite.SatelliteCatalog;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlannerConfig {
  private static final Logger log = LoggerFactory.getLogger(PlannerConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SatelliteCatalog satelliteCatalog(PlannerProperties properties) {
    InMemorySatelliteCatalog catalog = new InMemorySatelliteCatalog(properties.toSatellites());
    log.info("Satellite catalog loaded with {} entries", catalog.all().size());
    return catalog;
  }

  /**
   * Counts flight phase changes per target phase.
   */
  @Configuration(proxyBeanMethods = false)
  static class FlightPhaseMetrics {
    private final FlightStateManager flightStateManager;
    private final MeterRegistry meterRegistry;

    FlightPhaseMetrics(FlightStateManager flightStateManager, MeterRegistry meterRegistry) {
      this.flightStateManager = flightStateManager;
      this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void register() {
      flightStateManager.addListener((previous, current, reason) ->
          meterRegistry.counter("planner.flight.phase.transitions", "phase", current.name()).increment());
    }
  }
}
