package com.skycomm.planner.satellite;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog built from configuration.
 */
public class InMemorySatelliteCatalog implements SatelliteCatalog {
  private final Map<String, Satellite> byId;

  public InMemorySatelliteCatalog(List<Satellite> satellites) {
    Map<String, Satellite> index = new LinkedHashMap<>();
    for (Satellite satellite : satellites) {
      index.put(key(satellite.id()), satellite);
    }
    this.byId = Collections.unmodifiableMap(index);
  }

  @Override
  public Optional<Satellite> find(String satelliteId) {
    if (satelliteId == null || satelliteId.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(byId.get(key(satelliteId)));
  }

  @Override
  public Collection<Satellite> all() {
    return byId.values();
  }

  private static String key(String satelliteId) {
    return satelliteId.trim().toUpperCase(Locale.ROOT);
  }
}
