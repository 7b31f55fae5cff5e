package com.skycomm.planner.flight;

public enum FlightPhase {
  PRE_DEPARTURE,
  IN_FLIGHT,
  POST_ARRIVAL;

  /** ETA mode implied by the phase. */
  public EtaMode etaMode() {
    return this == PRE_DEPARTURE ? EtaMode.ANTICIPATED : EtaMode.ESTIMATED;
  }
}
