package com.skycomm.planner.poi;

import java.util.Optional;

/**
 * Point of interest tracked for ETA.
 *
 * @param id POI identifier
 * @param name display name, also matched against route waypoint names
 * @param latitude latitude in degrees
 * @param longitude longitude in degrees
 * @param category free category label
 * @param routeId route the POI belongs to, {@code null} for global POIs
 * @param projection nearest-route projection, {@code null} when not computed
 */
public record Poi(
    String id,
    String name,
    double latitude,
    double longitude,
    String category,
    String routeId,
    PoiProjection projection) {

  public static Poi global(String id, String name, double latitude, double longitude) {
    return new Poi(id, name, latitude, longitude, null, null, null);
  }

  public boolean isGlobal() {
    return routeId == null;
  }

  public Optional<PoiProjection> routeProjection() {
    return Optional.ofNullable(projection);
  }
}
