package com.skycomm.planner.mission;

import com.skycomm.planner.route.MissionWindow;
import java.util.Optional;

/**
 * Input of a mission timeline build.
 *
 * @param id mission identifier, used to name segments
 * @param name display name
 * @param transports transport plan
 * @param windowOverride explicit mission window, used when the route carries no timing
 */
public record MissionConfig(String id, String name, TransportConfig transports, MissionWindow windowOverride) {

  public MissionConfig(String id, String name, TransportConfig transports) {
    this(id, name, transports, null);
  }

  public Optional<MissionWindow> window() {
    return Optional.ofNullable(windowOverride);
  }
}
