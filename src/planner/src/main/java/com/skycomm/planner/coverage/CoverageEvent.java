package com.skycomm.planner.coverage;

import java.time.Instant;

/**
 * Change of the covering set between two consecutive route samples.
 *
 * @param type entry or exit
 * @param satelliteId satellite whose footprint was entered or left
 * @param timestamp time of the sample where the change was observed
 * @param latitude sample latitude
 * @param longitude sample longitude
 */
public record CoverageEvent(
    CoverageEventType type, String satelliteId, Instant timestamp, double latitude, double longitude) {}
