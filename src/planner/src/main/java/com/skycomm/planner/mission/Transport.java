package com.skycomm.planner.mission;

/**
 * The three modelled communication links.
 */
public enum Transport {
  /** Fixed geostationary link, steered antenna with aft and refueling exclusion cones. */
  X("X"),
  /** Three-satellite geostationary constellation with polygon footprints. */
  KA("Ka"),
  /** Always-on low-earth-orbit constellation. */
  KU("Ku");

  private final String label;

  Transport(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
