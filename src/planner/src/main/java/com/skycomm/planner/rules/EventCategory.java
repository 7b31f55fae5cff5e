package com.skycomm.planner.rules;

/**
 * Event families and the effect their opening events have on a transport.
 */
public enum EventCategory {
  AZIMUTH(ConditionKind.DEGRADED),
  TRANSITION(ConditionKind.DEGRADED),
  COVERAGE(ConditionKind.DEGRADED),
  OUTAGE(ConditionKind.OFFLINE),
  SAFETY_BUFFER(ConditionKind.SAFETY),
  REFUELING(ConditionKind.MARKER);

  private final ConditionKind conditionKind;

  EventCategory(ConditionKind conditionKind) {
    this.conditionKind = conditionKind;
  }

  public ConditionKind conditionKind() {
    return conditionKind;
  }

  /** How an open condition of this family weighs on transport state. */
  public enum ConditionKind {
    /** Transport degraded while open. */
    DEGRADED,
    /** Transport offline while open. */
    OFFLINE,
    /** Reason recorded, transport state unchanged. */
    SAFETY,
    /** Timeline annotation only. */
    MARKER
  }
}
