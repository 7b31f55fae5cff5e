package com.skycomm.planner.timeline;

public record MissionTimelineResult(MissionTimeline timeline, TimelineSummary summary) {}
