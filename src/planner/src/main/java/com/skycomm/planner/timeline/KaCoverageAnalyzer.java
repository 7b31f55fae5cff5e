package com.skycomm.planner.timeline;

import com.skycomm.planner.route.RouteSample;
import com.skycomm.planner.route.RouteTemporalProjector;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies Ka coverage changes along the sampled route into gaps and swaps.
 *
 * <p>Boundaries are placed halfway, by distance, between the two samples where the change is
 * observed.
 */
public class KaCoverageAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(KaCoverageAnalyzer.class);
  private static final double ANTIMERIDIAN_ARTEFACT_DEGREES = 300.0;

  /**
   * Walks samples carrying coverage sets.
   *
   * @param samples chronologically ordered samples
   * @param projector projector used to interpolate boundary positions
   * @return gaps and swaps in route order
   */
  public KaCoverageAnalysis analyze(List<RouteSample> samples, RouteTemporalProjector projector) {
    List<KaCoverageGap> gaps = new ArrayList<>();
    List<KaCoverageSwap> swaps = new ArrayList<>();
    if (samples.isEmpty()) {
      return new KaCoverageAnalysis(gaps, swaps);
    }

    RouteSample first = samples.get(0);
    RouteSample gapStart = first.coveringSatellites().isEmpty() ? first : null;
    String lostSatellite = null;
    String swapFrom = null;
    String swapTo = null;
    RouteSample swapStart = null;

    for (int i = 1; i < samples.size(); i++) {
      RouteSample previousSample = samples.get(i - 1);
      RouteSample sample = samples.get(i);
      Set<String> previous = previousSample.coveringSatellites();
      Set<String> current = sample.coveringSatellites();

      if (gapStart == null && !previous.isEmpty() && current.isEmpty()) {
        gapStart = boundary(projector, previousSample, sample);
        lostSatellite = firstOf(previous);
        swapStart = null;
        swapFrom = null;
        swapTo = null;
      } else if (gapStart != null && !current.isEmpty()) {
        RouteSample gapEnd = boundary(projector, previousSample, sample);
        String regained = firstOf(current);
        if (isAntimeridianArtefact(gapStart, gapEnd, lostSatellite, regained)) {
          log.debug("Dropping antimeridian coverage artefact on {}", regained);
        } else {
          gaps.add(new KaCoverageGap("ka-gap-" + (gaps.size() + 1), gapStart, gapEnd, lostSatellite, regained));
        }
        gapStart = null;
        lostSatellite = null;
      }

      if (swapStart == null && previous.size() == 1 && !current.isEmpty() && !current.equals(previous)) {
        String from = firstOf(previous);
        TreeSet<String> added = new TreeSet<>(current);
        added.removeAll(previous);
        if (current.containsAll(previous) && current.size() >= 2) {
          swapStart = boundary(projector, previousSample, sample);
          swapFrom = from;
          swapTo = added.first();
        } else if (current.size() == 1) {
          // Direct handover between two samples: both boundaries coincide.
          RouteSample at = boundary(projector, previousSample, sample);
          swaps.add(new KaCoverageSwap(transitionId(from, added.first(), swaps.size()),
              from, added.first(), at, at, at));
        }
      } else if (swapStart != null && current.size() == 1 && current.contains(swapTo)) {
        RouteSample swapEnd = boundary(projector, previousSample, sample);
        RouteSample midpoint =
            projector.sampleAtDistance((swapStart.distanceMeters() + swapEnd.distanceMeters()) / 2.0);
        swaps.add(new KaCoverageSwap(transitionId(swapFrom, swapTo, swaps.size()),
            swapFrom, swapTo, swapStart, swapEnd, midpoint));
        swapStart = null;
      } else if (swapStart != null && current.size() == 1 && current.contains(swapFrom)) {
        // Overlap receded without a handover.
        swapStart = null;
      }
    }

    if (gapStart != null) {
      gaps.add(new KaCoverageGap("ka-gap-" + (gaps.size() + 1), gapStart, null, lostSatellite, null));
    }
    return new KaCoverageAnalysis(gaps, swaps);
  }

  private static RouteSample boundary(RouteTemporalProjector projector, RouteSample before, RouteSample after) {
    return projector.sampleAtDistance((before.distanceMeters() + after.distanceMeters()) / 2.0);
  }

  private static boolean isAntimeridianArtefact(
      RouteSample start, RouteSample end, String lost, String regained) {
    return lost != null
        && lost.equals(regained)
        && Math.abs(start.longitude() - end.longitude()) > ANTIMERIDIAN_ARTEFACT_DEGREES;
  }

  private static String transitionId(String from, String to, int index) {
    return from + "->" + to + "-" + index;
  }

  private static String firstOf(Set<String> satellites) {
    return new TreeSet<>(satellites).first();
  }
}
