package com.skycomm.planner.mission;

public enum TransportState {
  AVAILABLE,
  DEGRADED,
  OFFLINE;

  /** Returns the more severe of the two states. */
  public TransportState worst(TransportState other) {
    return other.ordinal() > ordinal() ? other : this;
  }
}
