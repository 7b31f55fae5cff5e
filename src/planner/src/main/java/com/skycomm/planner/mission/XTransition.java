package com.skycomm.planner.mission;

/**
 * A planned X satellite switch at a route location.
 *
 * @param id transition identifier
 * @param latitude switch latitude
 * @param longitude switch longitude
 * @param targetSatelliteId satellite in use after the switch
 * @param sameSatelliteTransition true for a beam change on the current satellite
 */
public record XTransition(
    String id,
    double latitude,
    double longitude,
    String targetSatelliteId,
    boolean sameSatelliteTransition) {}
