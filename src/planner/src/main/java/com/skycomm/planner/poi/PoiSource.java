package com.skycomm.planner.poi;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Read access to the POI store. */
public interface PoiSource {
  List<Poi> listPois();

  /**
   * Finds a global POI (one not bound to a route) by name, case-insensitively.
   */
  default Optional<Poi> findGlobalPoiByName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    String wanted = name.trim().toLowerCase(Locale.ROOT);
    return listPois().stream()
        .filter(Poi::isGlobal)
        .filter(poi -> poi.name() != null && poi.name().trim().toLowerCase(Locale.ROOT).equals(wanted))
        .findFirst();
  }
}
