package com.skycomm.planner.flight;

import java.time.Instant;

/**
 * Live aircraft position report.
 */
public record TelemetrySample(Instant timestamp, double latitude, double longitude, double speedKnots) {}
