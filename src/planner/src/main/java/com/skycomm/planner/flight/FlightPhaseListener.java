package com.skycomm.planner.flight;

/**
 * Notified after every flight phase change, outside the state lock.
 */
@FunctionalInterface
public interface FlightPhaseListener {
  void onPhaseChange(FlightPhase previous, FlightPhase current, String reason);
}
