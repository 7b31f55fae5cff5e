package com.skycomm.planner.coverage;

import java.util.Arrays;

/**
 * Closed polygon ring in (longitude, latitude) order.
 *
 * <p>Footprints crossing the antimeridian are stored as several rings, each one staying on its own
 * side of +/-180.
 */
public final class CoverageRing {
  private final double[] longitudes;
  private final double[] latitudes;

  public CoverageRing(double[] longitudes, double[] latitudes) {
    if (longitudes.length != latitudes.length) {
      throw new CoverageDataException("Ring coordinate arrays differ in length");
    }
    if (longitudes.length < 3) {
      throw new CoverageDataException("Ring needs at least 3 vertices, got " + longitudes.length);
    }
    this.longitudes = Arrays.copyOf(longitudes, longitudes.length);
    this.latitudes = Arrays.copyOf(latitudes, latitudes.length);
  }

  public int size() {
    return longitudes.length;
  }

  /**
   * Ray-casting containment test.
   */
  public boolean contains(double longitude, double latitude) {
    boolean inside = false;
    int n = longitudes.length;
    double lon1 = longitudes[0];
    double lat1 = latitudes[0];
    for (int i = 1; i <= n; i++) {
      double lon2 = longitudes[i % n];
      double lat2 = latitudes[i % n];
      if (latitude > Math.min(lat1, lat2)
          && latitude <= Math.max(lat1, lat2)
          && longitude <= Math.max(lon1, lon2)) {
        double crossing = (latitude - lat1) * (lon2 - lon1) / (lat2 - lat1) + lon1;
        if (lon1 == lon2 || longitude <= crossing) {
          inside = !inside;
        }
      }
      lon1 = lon2;
      lat1 = lat2;
    }
    return inside;
  }
}
