package com.skycomm.planner.flight;

/**
 * How ETAs are computed: from planned times before departure, from live progress afterwards.
 */
public enum EtaMode {
  ANTICIPATED,
  ESTIMATED
}
