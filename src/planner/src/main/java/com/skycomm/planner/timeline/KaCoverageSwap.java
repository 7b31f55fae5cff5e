package com.skycomm.planner.timeline;

import com.skycomm.planner.route.RouteSample;

/**
 * Handover between two Ka satellites without loss of coverage.
 *
 * @param transitionId identifier, {@code FROM->TO-n}
 * @param fromSatellite satellite handed over from
 * @param toSatellite satellite handed over to
 * @param overlapStart where the new satellite starts covering
 * @param overlapEnd where the old satellite stops covering
 * @param midpoint route position halfway between the two boundaries, used to place the buffer
 */
public record KaCoverageSwap(
    String transitionId,
    String fromSatellite,
    String toSatellite,
    RouteSample overlapStart,
    RouteSample overlapEnd,
    RouteSample midpoint) {}
