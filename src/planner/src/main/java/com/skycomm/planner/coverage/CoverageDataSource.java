package com.skycomm.planner.coverage;

import java.util.List;
import java.util.Map;

/** Source of named satellite coverage footprints. */
public interface CoverageDataSource {
  /**
   * Loads all footprints.
   *
   * @return rings keyed by satellite id
   * @throws CoverageDataException when the dataset is unreadable or malformed
   */
  Map<String, List<CoverageRing>> loadFootprints();
}
