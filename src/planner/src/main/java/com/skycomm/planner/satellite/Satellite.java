package com.skycomm.planner.satellite;

import com.skycomm.planner.mission.Transport;
import java.util.Optional;

/**
 * Catalog entry for a communication satellite.
 *
 * @param id satellite identifier, e.g. {@code AOR}
 * @param transport transport the satellite serves
 * @param longitude fixed sub-satellite longitude for geostationary satellites, {@code null} when
 *     unknown or not applicable
 * @param slot orbital slot label, informational
 */
public record Satellite(String id, Transport transport, Double longitude, String slot) {
  public Optional<Double> fixedLongitude() {
    return Optional.ofNullable(longitude);
  }
}
