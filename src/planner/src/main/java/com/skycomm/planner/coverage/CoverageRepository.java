package com.skycomm.planner.coverage;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the coverage dataset once, on first use, and keeps the resulting sampler for the process
 * lifetime.
 *
 * <p>A dataset that cannot be loaded degrades to "no coverage": the failure is logged and
 * {@link #sampler()} returns empty from then on.
 */
public class CoverageRepository {
  private static final Logger log = LoggerFactory.getLogger(CoverageRepository.class);

  private final CoverageDataSource dataSource;
  private volatile Optional<CoverageSampler> sampler;

  public CoverageRepository(CoverageDataSource dataSource) {
    this.dataSource = dataSource;
  }

  public Optional<CoverageSampler> sampler() {
    Optional<CoverageSampler> loaded = sampler;
    if (loaded == null) {
      synchronized (this) {
        loaded = sampler;
        if (loaded == null) {
          loaded = load();
          sampler = loaded;
        }
      }
    }
    return loaded;
  }

  private Optional<CoverageSampler> load() {
    try {
      CoverageSampler loaded = new CoverageSampler(dataSource.loadFootprints());
      if (loaded.isEmpty()) {
        log.warn("Coverage dataset holds no footprints, Ka coverage analysis disabled");
        return Optional.empty();
      }
      log.info("Loaded coverage footprints for satellites {}", loaded.satelliteIds());
      return Optional.of(loaded);
    } catch (CoverageDataException ex) {
      log.warn("Coverage dataset unavailable, continuing without Ka coverage: {}", ex.getMessage());
      return Optional.empty();
    }
  }
}
