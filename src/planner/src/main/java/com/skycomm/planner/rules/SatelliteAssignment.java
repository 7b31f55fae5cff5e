package com.skycomm.planner.rules;

import java.time.Instant;

/**
 * X satellite in use from {@code effectiveFrom} until the next assignment.
 */
public record SatelliteAssignment(Instant effectiveFrom, String satelliteId) {}
