package com.skycomm.planner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skycomm.planner.coverage.CoverageRepository;
import com.skycomm.planner.coverage.GeoJsonCoverageDataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Spring configuration for the Ka coverage dataset.
 *
 * <p>The dataset is read lazily on the first timeline build, not at startup.
 */
@Configuration
public class CoverageConfig {

  /**
   * Creates the coverage repository unless {@code planner.coverage.enabled=false}.
   *
   * @param properties planner configuration properties
   * @param resourceLoader resolves {@code classpath:} and {@code file:} locations
   * @param objectMapper JSON parser
   * @return lazily loading repository
   */
  @Bean
  @ConditionalOnProperty(prefix = "planner.coverage", name = "enabled", havingValue = "true", matchIfMissing = true)
  public CoverageRepository coverageRepository(
      PlannerProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    String location = properties.getCoverage().getLocation();
    if (location == null || location.isBlank()) {
      throw new IllegalStateException("planner.coverage.enabled=true but planner.coverage.location is empty");
    }
    return new CoverageRepository(
        new GeoJsonCoverageDataSource(resourceLoader.getResource(location), objectMapper));
  }
}
