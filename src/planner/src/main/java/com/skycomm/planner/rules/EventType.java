package com.skycomm.planner.rules;

/**
 * Mission event types. Each type belongs to one {@link EventCategory} and either opens or closes a
 * condition.
 */
public enum EventType {
  X_AZIMUTH_VIOLATION(EventCategory.AZIMUTH, true),
  X_AZIMUTH_CLEAR(EventCategory.AZIMUTH, false),
  X_TRANSITION_START(EventCategory.TRANSITION, true),
  X_TRANSITION_END(EventCategory.TRANSITION, false),
  KA_TRANSITION_START(EventCategory.TRANSITION, true),
  KA_TRANSITION_END(EventCategory.TRANSITION, false),
  KA_COVERAGE_EXIT(EventCategory.COVERAGE, true),
  KA_COVERAGE_ENTRY(EventCategory.COVERAGE, false),
  KA_OUTAGE_START(EventCategory.OUTAGE, true),
  KA_OUTAGE_END(EventCategory.OUTAGE, false),
  KU_OUTAGE_START(EventCategory.OUTAGE, true),
  KU_OUTAGE_END(EventCategory.OUTAGE, false),
  TAKEOFF_BUFFER_START(EventCategory.SAFETY_BUFFER, true),
  TAKEOFF_BUFFER_END(EventCategory.SAFETY_BUFFER, false),
  LANDING_BUFFER_START(EventCategory.SAFETY_BUFFER, true),
  LANDING_BUFFER_END(EventCategory.SAFETY_BUFFER, false),
  REFUELING_START(EventCategory.REFUELING, true),
  REFUELING_END(EventCategory.REFUELING, false);

  private final EventCategory category;
  private final boolean opening;

  EventType(EventCategory category, boolean opening) {
    this.category = category;
    this.opening = opening;
  }

  public EventCategory category() {
    return category;
  }

  public boolean opening() {
    return opening;
  }

  public boolean isTransitionStart() {
    return this == X_TRANSITION_START || this == KA_TRANSITION_START;
  }

  public boolean isTransitionEnd() {
    return this == X_TRANSITION_END || this == KA_TRANSITION_END;
  }
}
