package com.skycomm.planner.poi;

/**
 * Precomputed nearest-route position of an off-route point of interest.
 *
 * @param latitude projected latitude on the route
 * @param longitude projected longitude on the route
 * @param routePointIndex index into {@link com.skycomm.planner.route.ParsedRoute#points()} of the
 *     route point nearest the projection, {@code null} when unknown
 * @param routeProgressPercent progress along the route, 0..100, {@code null} when unknown
 */
public record PoiProjection(
    double latitude, double longitude, Integer routePointIndex, Double routeProgressPercent) {}
