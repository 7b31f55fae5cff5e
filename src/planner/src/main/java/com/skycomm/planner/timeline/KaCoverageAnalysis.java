package com.skycomm.planner.timeline;

import java.util.List;

public record KaCoverageAnalysis(List<KaCoverageGap> gaps, List<KaCoverageSwap> swaps) {
  public KaCoverageAnalysis {
    gaps = List.copyOf(gaps);
    swaps = List.copyOf(swaps);
  }
}
