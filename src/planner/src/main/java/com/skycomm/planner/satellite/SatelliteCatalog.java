package com.skycomm.planner.satellite;

import java.util.Collection;
import java.util.Optional;

/** Lookup of satellites by identifier. */
public interface SatelliteCatalog {
  /**
   * Finds a satellite by id, case-insensitively.
   *
   * @param satelliteId satellite identifier
   * @return matching satellite when known
   */
  Optional<Satellite> find(String satelliteId);

  Collection<Satellite> all();

  default Optional<Double> longitudeOf(String satelliteId) {
    return find(satelliteId).flatMap(Satellite::fixedLongitude);
  }
}
