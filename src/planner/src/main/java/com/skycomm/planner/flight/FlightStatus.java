package com.skycomm.planner.flight;

import java.time.Instant;

/**
 * Immutable snapshot of the flight state.
 *
 * @param phase current phase
 * @param etaMode mode derived from the phase
 * @param departureTime detected or declared departure, {@code null} before departure
 * @param arrivalTime detected or declared arrival, {@code null} before arrival
 * @param speedPersistenceSeconds how long speed has stayed above the departure threshold
 * @param arrivalDwellSeconds how long the aircraft has stayed within the arrival distance
 * @param activeRouteId active route, {@code null} when none
 * @param activeRouteName active route name
 * @param hasTimingData whether the active route carries planned times
 * @param scheduledDepartureTime planned departure of the active route
 * @param scheduledArrivalTime planned arrival of the active route
 * @param timeUntilDepartureSeconds seconds until the planned departure, zero once departed,
 *     {@code null} without a schedule
 * @param timeSinceDepartureSeconds seconds since departure, {@code null} before departure
 * @param lastDepartureCheck time of the last departure check
 * @param lastArrivalCheck time of the last arrival check
 * @param snapshotTime time the snapshot was taken
 */
public record FlightStatus(
    FlightPhase phase,
    EtaMode etaMode,
    Instant departureTime,
    Instant arrivalTime,
    double speedPersistenceSeconds,
    double arrivalDwellSeconds,
    String activeRouteId,
    String activeRouteName,
    boolean hasTimingData,
    Instant scheduledDepartureTime,
    Instant scheduledArrivalTime,
    Long timeUntilDepartureSeconds,
    Long timeSinceDepartureSeconds,
    Instant lastDepartureCheck,
    Instant lastArrivalCheck,
    Instant snapshotTime) {

  public boolean isPreDeparture() {
    return phase == FlightPhase.PRE_DEPARTURE;
  }
}
