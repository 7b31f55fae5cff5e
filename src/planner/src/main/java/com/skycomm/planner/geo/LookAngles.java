package com.skycomm.planner.geo;

/**
 * Topocentric look angles from an observer to a satellite.
 *
 * @param azimuthDegrees true azimuth in [0, 360)
 * @param elevationDegrees elevation above the local horizon, negative when below it
 */
public record LookAngles(double azimuthDegrees, double elevationDegrees) {}
