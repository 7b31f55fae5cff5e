package com.skycomm.planner.timeline;

import com.skycomm.planner.mission.TimelineStatus;
import com.skycomm.planner.route.MissionWindow;
import com.skycomm.planner.rules.Advisory;
import com.skycomm.planner.rules.MissionEvent;
import com.skycomm.planner.rules.ResolvedRefuelingWindow;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;

/**
 * Result of a timeline build. Built fresh per computation and never mutated.
 */
public record MissionTimeline(
    String missionId,
    MissionWindow window,
    List<TimelineSegment> segments,
    List<Advisory> advisories,
    List<MissionEvent> events,
    List<ResolvedRefuelingWindow> refuelingBlocks,
    List<MissionMarker> markers,
    TimelineStatistics statistics) {

  public MissionTimeline {
    segments = List.copyOf(segments);
    advisories = List.copyOf(advisories);
    events = List.copyOf(events);
    refuelingBlocks = List.copyOf(refuelingBlocks);
    markers = List.copyOf(markers);
  }

  /**
   * Seconds from {@code now} until the next non-nominal segment starts; zero when one is in
   * progress, empty when none is left.
   */
  public OptionalLong secondsUntilNextConflict(Instant now) {
    for (TimelineSegment segment : segments) {
      if (segment.status() == TimelineStatus.NOMINAL || !segment.end().isAfter(now)) {
        continue;
      }
      return OptionalLong.of(Math.max(0, Duration.between(now, segment.start()).getSeconds()));
    }
    return OptionalLong.empty();
  }
}
