package com.skycomm.planner.timeline;

import com.skycomm.planner.route.RouteSample;

/**
 * Stretch of route without any Ka coverage.
 *
 * @param id gap identifier
 * @param start interpolated position where coverage is lost
 * @param end interpolated position where coverage returns, {@code null} when it does not
 * @param lostSatellite last covering satellite, {@code null} when the route starts uncovered
 * @param regainedSatellite first covering satellite after the gap, {@code null} when open
 */
public record KaCoverageGap(
    String id, RouteSample start, RouteSample end, String lostSatellite, String regainedSatellite) {}
