package com.skycomm.planner.mission;

import java.util.List;

/**
 * Per-mission transport plan.
 *
 * @param initialXSatelliteId X satellite assigned at mission start
 * @param xTransitions planned X satellite switches
 * @param kaOutages manual Ka outages
 * @param kuOutages manual Ku outages
 * @param refuelingWindows refueling segments affecting the X antenna limits
 */
public record TransportConfig(
    String initialXSatelliteId,
    List<XTransition> xTransitions,
    List<ManualOutage> kaOutages,
    List<ManualOutage> kuOutages,
    List<RefuelingWindow> refuelingWindows) {

  public TransportConfig {
    xTransitions = xTransitions == null ? List.of() : List.copyOf(xTransitions);
    kaOutages = kaOutages == null ? List.of() : List.copyOf(kaOutages);
    kuOutages = kuOutages == null ? List.of() : List.copyOf(kuOutages);
    refuelingWindows = refuelingWindows == null ? List.of() : List.copyOf(refuelingWindows);
  }

  public static TransportConfig singleSatellite(String xSatelliteId) {
    return new TransportConfig(xSatelliteId, List.of(), List.of(), List.of(), List.of());
  }
}
