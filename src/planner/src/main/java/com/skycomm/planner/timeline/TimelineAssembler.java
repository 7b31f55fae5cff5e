package com.skycomm.planner.timeline;

import com.skycomm.planner.mission.TimelineStatus;
import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.mission.TransportState;
import com.skycomm.planner.route.MissionWindow;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges the per-transport partitions into aggregate timeline segments.
 */
public class TimelineAssembler {

  /**
   * Cuts the mission window at every interval boundary of every transport.
   *
   * <p>A segment whose only impact is an expected X/Ku aft conflict is reported nominal; its
   * reasons are kept.
   *
   * @param missionId mission identifier used in segment ids
   * @param window mission window
   * @param intervals partition of the window per transport
   * @return segments tiling the window in order
   */
  public List<TimelineSegment> assemble(
      String missionId, MissionWindow window, Map<Transport, List<TransportInterval>> intervals) {
    TreeSet<Instant> boundaries = new TreeSet<>();
    boundaries.add(window.start());
    boundaries.add(window.end());
    intervals.values().forEach(list -> list.forEach(interval -> {
      addIfInside(boundaries, window, interval.start());
      addIfInside(boundaries, window, interval.end());
    }));

    List<TimelineSegment> segments = new ArrayList<>();
    Iterator<Instant> it = boundaries.iterator();
    Instant start = it.next();
    while (it.hasNext()) {
      Instant end = it.next();
      segments.add(segment(String.format("%s-segment-%03d", missionId, segments.size() + 1),
          start, end, intervals));
      start = end;
    }
    return segments;
  }

  /**
   * Sums time per status and locates the first non-nominal segment.
   */
  public TimelineStatistics attachStatistics(List<TimelineSegment> segments, MissionWindow window) {
    double total = Math.max(seconds(window.duration()), 1.0);
    double degraded = 0.0;
    double critical = 0.0;
    double nextConflict = -1.0;
    for (TimelineSegment segment : segments) {
      double length = seconds(segment.duration());
      switch (segment.status()) {
        case DEGRADED -> degraded += length;
        case CRITICAL -> critical += length;
        default -> {
          continue;
        }
      }
      if (nextConflict < 0) {
        nextConflict = seconds(Duration.between(window.start(), segment.start()));
      }
    }
    double nominal = Math.max(total - degraded - critical, 0.0);
    return new TimelineStatistics(total, nominal, degraded, critical, nextConflict);
  }

  private static TimelineSegment segment(
      String id, Instant start, Instant end, Map<Transport, List<TransportInterval>> intervals) {
    Map<Transport, TransportState> states = new EnumMap<>(Transport.class);
    Set<String> reasons = new LinkedHashSet<>();
    List<Transport> impacted = new ArrayList<>();
    boolean safety = false;
    boolean expectedOnly = true;
    for (Transport transport : Transport.values()) {
      TransportInterval interval = intervalAt(intervals.getOrDefault(transport, List.of()), start);
      if (interval == null) {
        states.put(transport, TransportState.AVAILABLE);
        continue;
      }
      states.put(transport, interval.state());
      reasons.addAll(interval.reasons());
      safety |= interval.safetyWindow();
      if (interval.state() != TransportState.AVAILABLE) {
        impacted.add(transport);
        expectedOnly &= interval.expectedConflictOnly();
      }
    }

    boolean downgrade = impacted.equals(List.of(Transport.X)) && expectedOnly;
    TimelineStatus status = downgrade
        ? TimelineStatus.NOMINAL
        : TimelineStatus.fromImpactedCount(impacted.size());
    return new TimelineSegment(id, start, end, status, states, new ArrayList<>(reasons), impacted,
        safety, downgrade);
  }

  private static TransportInterval intervalAt(List<TransportInterval> intervals, Instant instant) {
    for (TransportInterval interval : intervals) {
      if (interval.covers(instant)) {
        return interval;
      }
    }
    return null;
  }

  private static void addIfInside(TreeSet<Instant> boundaries, MissionWindow window, Instant instant) {
    if (window.contains(instant)) {
      boundaries.add(instant);
    }
  }

  private static double seconds(Duration duration) {
    return duration.toMillis() / 1000.0;
  }
}
