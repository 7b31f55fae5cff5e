package com.skycomm.planner.coverage;

import com.skycomm.planner.geo.GeoMath;
import com.skycomm.planner.route.CoverageLookup;
import com.skycomm.planner.route.RouteSample;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Point-in-footprint lookups against an immutable set of satellite footprints.
 *
 * <p>A satellite covers a point when any of its rings contains it. Instances are read-only and
 * safe to share between concurrent timeline builds.
 */
public class CoverageSampler implements CoverageLookup {
  private final Map<String, List<CoverageRing>> footprints;

  public CoverageSampler(Map<String, List<CoverageRing>> footprints) {
    Map<String, List<CoverageRing>> copy = new LinkedHashMap<>();
    footprints.forEach((id, rings) -> copy.put(id, List.copyOf(rings)));
    this.footprints = Collections.unmodifiableMap(copy);
  }

  public Set<String> satelliteIds() {
    return footprints.keySet();
  }

  public boolean isEmpty() {
    return footprints.isEmpty();
  }

  /**
   * Returns the satellites covering the position, sorted by id.
   */
  @Override
  public SortedSet<String> coverageAt(double latitude, double longitude) {
    double lon = GeoMath.normalizeLongitude(longitude);
    TreeSet<String> covering = new TreeSet<>();
    for (Map.Entry<String, List<CoverageRing>> entry : footprints.entrySet()) {
      for (CoverageRing ring : entry.getValue()) {
        if (ring.contains(lon, latitude) || (lon == -180.0 && ring.contains(180.0, latitude))) {
          covering.add(entry.getKey());
          break;
        }
      }
    }
    return Collections.unmodifiableSortedSet(covering);
  }

  /**
   * Walks the samples and reports every change of the covering set: an exit for each satellite
   * that stopped covering, then an entry for each one that started. The walk starts from an empty
   * set, so a route beginning inside a footprint reports an entry on its first sample.
   *
   * @param samples chronologically ordered samples
   * @return entry/exit events in sample order
   */
  public List<CoverageEvent> sampleRouteCoverage(List<RouteSample> samples) {
    List<CoverageEvent> events = new ArrayList<>();
    SortedSet<String> previous = Collections.emptySortedSet();
    for (RouteSample sample : samples) {
      SortedSet<String> current = coverageAt(sample.latitude(), sample.longitude());
      for (String lost : previous) {
        if (!current.contains(lost)) {
          events.add(new CoverageEvent(CoverageEventType.EXIT, lost, sample.timestamp(),
              sample.latitude(), sample.longitude()));
        }
      }
      for (String gained : current) {
        if (!previous.contains(gained)) {
          events.add(new CoverageEvent(CoverageEventType.ENTRY, gained, sample.timestamp(),
              sample.latitude(), sample.longitude()));
        }
      }
      previous = current;
    }
    return events;
  }
}
