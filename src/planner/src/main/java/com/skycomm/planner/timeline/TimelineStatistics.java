package com.skycomm.planner.timeline;

/**
 * Seconds spent per aggregate status.
 *
 * @param totalSeconds mission duration, at least one second
 * @param nominalSeconds time in nominal segments
 * @param degradedSeconds time in degraded segments
 * @param criticalSeconds time in critical segments
 * @param nextConflictSeconds seconds from mission start to the first non-nominal segment, -1 if
 *     there is none
 */
public record TimelineStatistics(
    double totalSeconds,
    double nominalSeconds,
    double degradedSeconds,
    double criticalSeconds,
    double nextConflictSeconds) {}
