package com.skycomm.planner.eta;

import com.skycomm.planner.flight.EtaMode;
import com.skycomm.planner.flight.FlightPhase;

/**
 * Distance and ETA of one POI.
 *
 * @param poiId POI identifier
 * @param poiName POI name
 * @param category POI category
 * @param distanceMeters great-circle distance from the aircraft
 * @param etaSeconds ETA in seconds, {@link EtaCalculator#UNKNOWN_ETA} when unknown
 * @param etaType mode the ETA was computed in
 * @param passed whether the aircraft has passed the POI
 * @param flightPhase flight phase at computation time
 * @param preDeparture true before departure
 */
public record PoiMetrics(
    String poiId,
    String poiName,
    String category,
    double distanceMeters,
    double etaSeconds,
    EtaMode etaType,
    boolean passed,
    FlightPhase flightPhase,
    boolean preDeparture) {

  public boolean hasEta() {
    return etaSeconds >= 0;
  }
}
