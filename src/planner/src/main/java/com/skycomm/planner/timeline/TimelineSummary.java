package com.skycomm.planner.timeline;

import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.mission.TransportState;
import java.time.Instant;
import java.util.Map;

/**
 * Compact digest of a timeline build.
 *
 * @param missionId mission identifier
 * @param missionStart mission window start
 * @param missionEnd mission window end
 * @param totalSeconds mission duration
 * @param degradedSeconds time in degraded segments
 * @param criticalSeconds time in critical segments
 * @param nextConflictSeconds seconds from start to the first non-nominal segment, -1 if none
 * @param worstStates worst state reached by each transport
 * @param sampleCount number of route samples evaluated
 * @param sampleIntervalSeconds spacing of the samples
 * @param generationRuntimeMs build duration
 */
public record TimelineSummary(
    String missionId,
    Instant missionStart,
    Instant missionEnd,
    double totalSeconds,
    double degradedSeconds,
    double criticalSeconds,
    double nextConflictSeconds,
    Map<Transport, TransportState> worstStates,
    int sampleCount,
    int sampleIntervalSeconds,
    long generationRuntimeMs) {

  public TimelineSummary {
    worstStates = Map.copyOf(worstStates);
  }
}
