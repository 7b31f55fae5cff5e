package com.skycomm.planner.route;

import java.util.Set;

/**
 * Resolves the set of satellites covering a position.
 */
@FunctionalInterface
public interface CoverageLookup {
  Set<String> coverageAt(double latitude, double longitude);
}
