package com.skycomm.planner.geo;

/**
 * Great-circle helpers shared by the route projector, the rule engine and the ETA calculator.
 */
public final class GeoMath {
  public static final double EARTH_RADIUS_METERS = 6_371_000.0;
  public static final double METERS_PER_NAUTICAL_MILE = 1852.0;

  private GeoMath() {}

  /**
   * Haversine distance in meters.
   */
  public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
    requireFinite(lat1, lon1);
    requireFinite(lat2, lon2);
    double phi1 = Math.toRadians(lat1);
    double phi2 = Math.toRadians(lat2);
    double dPhi = Math.toRadians(lat2 - lat1);
    double dLambda = Math.toRadians(lon2 - lon1);
    double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
        + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return EARTH_RADIUS_METERS * c;
  }

  /**
   * Initial bearing from the first point to the second, in [0, 360).
   */
  public static double initialBearing(double lat1, double lon1, double lat2, double lon2) {
    double phi1 = Math.toRadians(lat1);
    double phi2 = Math.toRadians(lat2);
    double dLambda = Math.toRadians(lon2 - lon1);
    double x = Math.sin(dLambda) * Math.cos(phi2);
    double y = Math.cos(phi1) * Math.sin(phi2) - Math.sin(phi1) * Math.cos(phi2) * Math.cos(dLambda);
    return normalizeDegrees(Math.toDegrees(Math.atan2(x, y)));
  }

  /**
   * Interpolates longitude along the shortest arc, so that a segment crossing the antimeridian
   * stays near +/-180 instead of sweeping back through 0.
   *
   * @param from longitude at ratio 0
   * @param to longitude at ratio 1
   * @param ratio fraction in [0, 1]
   * @return longitude normalized to [-180, 180]
   */
  public static double interpolateLongitude(double from, double to, double ratio) {
    double start = from;
    double end = to;
    if (Math.abs(end - start) > 180.0) {
      // Shift into 0..360 so the short way round is a plain linear blend.
      if (start < 0) {
        start += 360.0;
      }
      if (end < 0) {
        end += 360.0;
      }
    }
    double value = normalizeLongitude(start + (end - start) * ratio);
    return Math.abs(value + 180.0) < 1e-9 ? 180.0 : value;
  }

  public static double normalizeLongitude(double longitude) {
    return normalizeDegrees(longitude + 180.0) - 180.0;
  }

  public static double normalizeDegrees(double degrees) {
    double value = degrees % 360.0;
    if (value < 0) {
      value += 360.0;
    }
    return value >= 360.0 ? 0.0 : value;
  }

  public static double knotsToMetersPerSecond(double knots) {
    return knots * METERS_PER_NAUTICAL_MILE / 3600.0;
  }

  static void requireFinite(double lat, double lon) {
    if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
      throw new GeometryInputException("Non-finite coordinate: lat=" + lat + " lon=" + lon);
    }
  }
}
