package com.skycomm.planner.geo;

/**
 * Look-angle math for geostationary satellites modelled at a fixed sub-satellite longitude.
 *
 * <p>Observer and satellite are placed in WGS84 Earth-centred coordinates and the line of sight is
 * rotated into the observer's South-East-Zenith frame.
 */
public final class SatelliteGeometry {
  public static final double GEO_ALTITUDE_METERS = 35_786_000.0;

  private static final double WGS84_A = 6_378_137.0;
  private static final double WGS84_E2 = 6.69437999014132e-3;

  private SatelliteGeometry() {}

  /**
   * Computes azimuth and elevation from an observer to a geostationary satellite.
   *
   * @param latitude observer latitude in degrees
   * @param longitude observer longitude in degrees
   * @param altitudeMeters observer altitude above the ellipsoid
   * @param satelliteLongitude sub-satellite longitude in degrees
   * @return look angles with azimuth in [0, 360)
   * @throws GeometryInputException when any input is not finite
   */
  public static LookAngles lookAngles(
      double latitude, double longitude, double altitudeMeters, double satelliteLongitude) {
    if (!Double.isFinite(latitude)
        || !Double.isFinite(longitude)
        || !Double.isFinite(altitudeMeters)
        || !Double.isFinite(satelliteLongitude)) {
      throw new GeometryInputException(String.format(
          "Non-finite look-angle input: lat=%s lon=%s alt=%s satLon=%s",
          latitude, longitude, altitudeMeters, satelliteLongitude));
    }

    double[] observer = toEcef(latitude, longitude, altitudeMeters);
    double[] satellite = toEcef(0.0, satelliteLongitude, GEO_ALTITUDE_METERS);

    double dx = satellite[0] - observer[0];
    double dy = satellite[1] - observer[1];
    double dz = satellite[2] - observer[2];

    double lat = Math.toRadians(latitude);
    double lon = Math.toRadians(longitude);
    double sinLat = Math.sin(lat);
    double cosLat = Math.cos(lat);
    double sinLon = Math.sin(lon);
    double cosLon = Math.cos(lon);

    double south = sinLat * cosLon * dx + sinLat * sinLon * dy - cosLat * dz;
    double east = -sinLon * dx + cosLon * dy;
    double zenith = cosLat * cosLon * dx + cosLat * sinLon * dy + sinLat * dz;

    double range = Math.sqrt(south * south + east * east + zenith * zenith);
    double elevation = range == 0.0 ? 90.0 : Math.toDegrees(Math.asin(zenith / range));
    double azimuth = GeoMath.normalizeDegrees(Math.toDegrees(Math.atan2(east, -south)));
    return new LookAngles(azimuth, elevation);
  }

  /**
   * Tests whether an azimuth falls inside an inclusive arc. When {@code min > max} the arc wraps
   * through north, e.g. 315..45 covers 350, 0 and 30.
   */
  public static boolean isInAzimuthRange(double azimuth, double min, double max) {
    double az = GeoMath.normalizeDegrees(azimuth);
    double lo = GeoMath.normalizeDegrees(min);
    double hi = GeoMath.normalizeDegrees(max);
    if (lo <= hi) {
      return az >= lo && az <= hi;
    }
    return az >= lo || az <= hi;
  }

  /**
   * Azimuth relative to the aircraft nose, in [0, 360).
   */
  public static double relativeAzimuth(double azimuth, double headingDegrees) {
    return GeoMath.normalizeDegrees(azimuth - headingDegrees);
  }

  private static double[] toEcef(double latitude, double longitude, double altitudeMeters) {
    double lat = Math.toRadians(latitude);
    double lon = Math.toRadians(longitude);
    double sinLat = Math.sin(lat);
    double n = WGS84_A / Math.sqrt(1.0 - WGS84_E2 * sinLat * sinLat);
    double x = (n + altitudeMeters) * Math.cos(lat) * Math.cos(lon);
    double y = (n + altitudeMeters) * Math.cos(lat) * Math.sin(lon);
    double z = (n * (1.0 - WGS84_E2) + altitudeMeters) * sinLat;
    return new double[] {x, y, z};
  }
}
