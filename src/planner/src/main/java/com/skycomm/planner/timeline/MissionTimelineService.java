package com.skycomm.planner.timeline;

import com.skycomm.planner.config.PlannerProperties;
import com.skycomm.planner.coverage.CoverageRepository;
import com.skycomm.planner.coverage.CoverageSampler;
import com.skycomm.planner.mission.ManualOutage;
import com.skycomm.planner.mission.MissionConfig;
import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.mission.TransportConfig;
import com.skycomm.planner.mission.TransportState;
import com.skycomm.planner.mission.XTransition;
import com.skycomm.planner.poi.Poi;
import com.skycomm.planner.poi.PoiSource;
import com.skycomm.planner.route.ConfigurationException;
import com.skycomm.planner.route.MissionWindow;
import com.skycomm.planner.route.ParsedRoute;
import com.skycomm.planner.route.RouteProjection;
import com.skycomm.planner.route.RouteSample;
import com.skycomm.planner.route.RouteTemporalProjector;
import com.skycomm.planner.rules.ConstraintConfig;
import com.skycomm.planner.rules.MissionEvent;
import com.skycomm.planner.rules.ResolvedRefuelingWindow;
import com.skycomm.planner.rules.RuleEngine;
import com.skycomm.planner.rules.SatelliteAssignment;
import com.skycomm.planner.satellite.SatelliteCatalog;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds mission communication timelines.
 *
 * <p>A build projects the route on the mission window, samples it, runs the Ka coverage analysis,
 * feeds every rule into a fresh {@link RuleEngine}, then partitions the window per transport and
 * merges the partitions into segments. Builds share no mutable state and may run concurrently.
 */
@Service
public class MissionTimelineService {
  private static final Logger log = LoggerFactory.getLogger(MissionTimelineService.class);

  private final PlannerProperties properties;
  private final SatelliteCatalog satelliteCatalog;
  private final Optional<CoverageRepository> coverageRepository;
  private final Optional<PoiSource> poiSource;
  private final KaCoverageAnalyzer coverageAnalyzer = new KaCoverageAnalyzer();
  private final RefuelingWindowResolver refuelingResolver = new RefuelingWindowResolver();
  private final TransportIntervalBuilder intervalBuilder = new TransportIntervalBuilder();
  private final TimelineAssembler assembler = new TimelineAssembler();
  private final Timer buildTimer;
  private final Counter buildSuccess;
  private final Counter buildConfigError;
  private final Counter buildFailure;

  public MissionTimelineService(
      PlannerProperties properties,
      SatelliteCatalog satelliteCatalog,
      Optional<CoverageRepository> coverageRepository,
      Optional<PoiSource> poiSource,
      MeterRegistry meterRegistry) {
    this.properties = properties;
    this.satelliteCatalog = satelliteCatalog;
    this.coverageRepository = coverageRepository;
    this.poiSource = poiSource;
    this.buildTimer = meterRegistry.timer("planner.timeline.build.duration");
    this.buildSuccess = meterRegistry.counter("planner.timeline.builds", "outcome", "success");
    this.buildConfigError = meterRegistry.counter("planner.timeline.builds", "outcome", "config_error");
    this.buildFailure = meterRegistry.counter("planner.timeline.builds", "outcome", "failure");
  }

  /**
   * Builds a timeline with the service's coverage dataset and POI store.
   */
  public MissionTimelineResult buildMissionTimeline(MissionConfig mission, ParsedRoute route) {
    Optional<CoverageSampler> sampler = coverageRepository.flatMap(CoverageRepository::sampler);
    return buildMissionTimeline(mission, route, sampler, poiSource);
  }

  /**
   * Builds a timeline.
   *
   * @param mission mission configuration
   * @param route route flown by the mission
   * @param coverageSampler Ka footprints; Ka coverage analysis is skipped when empty
   * @param pois POI store used to locate satellites missing from the catalog
   * @return timeline and summary
   * @throws ConfigurationException when the route cannot be placed on a time axis
   * @throws TimelineComputationException on any other failure
   */
  public MissionTimelineResult buildMissionTimeline(
      MissionConfig mission,
      ParsedRoute route,
      Optional<CoverageSampler> coverageSampler,
      Optional<PoiSource> pois) {
    long startedAt = System.nanoTime();
    try {
      MissionTimelineResult result = build(mission, route, coverageSampler, pois, startedAt);
      buildSuccess.increment();
      return result;
    } catch (ConfigurationException ex) {
      buildConfigError.increment();
      throw ex;
    } catch (RuntimeException ex) {
      buildFailure.increment();
      String missionId = mission == null ? null : mission.id();
      throw new TimelineComputationException("Failed to build timeline for mission " + missionId, ex);
    } finally {
      buildTimer.record(System.nanoTime() - startedAt, TimeUnit.NANOSECONDS);
    }
  }

  private MissionTimelineResult build(
      MissionConfig mission,
      ParsedRoute route,
      Optional<CoverageSampler> coverageSampler,
      Optional<PoiSource> pois,
      long startedAt) {
    if (mission == null || mission.id() == null || mission.id().isBlank()) {
      throw new ConfigurationException("Mission identifier is required");
    }
    TransportConfig transports = mission.transports() != null
        ? mission.transports()
        : TransportConfig.singleSatellite(null);

    RouteTemporalProjector projector = new RouteTemporalProjector(route, mission.windowOverride());
    MissionWindow window = projector.window();
    int interval = properties.getTimeline().getSampleIntervalSeconds();
    List<RouteSample> samples = projector.generateSamples(interval, coverageSampler.orElse(null));
    if (samples.size() > properties.getTimeline().getSampleWarnThreshold()) {
      log.warn("Mission {} produced {} samples at {}s interval; build may be slow",
          mission.id(), samples.size(), interval);
    }

    ConstraintConfig constraints = properties.getConstraints().toConstraintConfig();
    RuleEngine engine = new RuleEngine(constraints, window);
    List<MissionMarker> markers = new ArrayList<>();

    engine.addSafetyBuffers(window.start(), window.end());

    for (ResolvedRefuelingWindow refueling : refuelingResolver.resolve(transports.refuelingWindows(), route, projector)) {
      engine.addRefuelingWindow(refueling);
      markers.add(marker(MissionMarker.MarkerType.REFUELING_START, "AAR Start " + refueling.id(),
          projector.positionAtTime(refueling.start()), null));
      markers.add(marker(MissionMarker.MarkerType.REFUELING_END, "AAR End " + refueling.id(),
          projector.positionAtTime(refueling.end()), null));
    }

    List<SatelliteAssignment> schedule = new ArrayList<>();
    if (transports.initialXSatelliteId() != null && !transports.initialXSatelliteId().isBlank()) {
      schedule.add(new SatelliteAssignment(window.start(), transports.initialXSatelliteId()));
    }
    for (XTransition transition : transports.xTransitions()) {
      if (transition.targetSatelliteId() == null || transition.targetSatelliteId().isBlank()) {
        log.warn("Skipping X transition {} without target satellite", transition.id());
        continue;
      }
      RouteProjection projection = projector.project(transition.latitude(), transition.longitude());
      engine.addXTransition(transition.id(), projection.timestamp(), transition.targetSatelliteId(),
          transition.sameSatelliteTransition());
      schedule.add(new SatelliteAssignment(projection.timestamp(), transition.targetSatelliteId()));
      markers.add(new MissionMarker(MissionMarker.MarkerType.X_TRANSITION,
          "X Transition " + transition.id(), projection.timestamp(),
          transition.latitude(), transition.longitude(), transition.targetSatelliteId()));
    }

    if (coverageSampler.isPresent()) {
      applyKaCoverage(engine, markers, coverageAnalyzer.analyze(samples, projector));
    }

    for (ManualOutage outage : transports.kaOutages()) {
      engine.addManualOutage(Transport.KA, outage);
    }
    for (ManualOutage outage : transports.kuOutages()) {
      engine.addManualOutage(Transport.KU, outage);
    }

    engine.applyAzimuthSweep(samples, schedule, longitudeResolver(pois));

    List<MissionEvent> events = engine.sortedEvents();
    Map<Transport, List<TransportInterval>> intervals = new EnumMap<>(Transport.class);
    for (Transport transport : Transport.values()) {
      intervals.put(transport, intervalBuilder.build(events, transport, window));
    }
    List<TimelineSegment> segments = assembler.assemble(mission.id(), window, intervals);
    TimelineStatistics statistics = assembler.attachStatistics(segments, window);

    MissionTimeline timeline = new MissionTimeline(
        mission.id(),
        window,
        segments,
        engine.generateAdvisories(),
        events,
        engine.refuelingWindows(),
        markers,
        statistics);

    long runtimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    if (runtimeMs > properties.getTimeline().getSlowBuildWarnMs()) {
      log.warn("Timeline build for mission {} took {} ms ({} samples)", mission.id(), runtimeMs, samples.size());
    }
    log.info("Built timeline for mission {}: {} segments, {} events, {} advisories",
        mission.id(), segments.size(), events.size(), timeline.advisories().size());
    return new MissionTimelineResult(timeline, summarize(timeline, intervals, samples.size(), interval, runtimeMs));
  }

  private static void applyKaCoverage(RuleEngine engine, List<MissionMarker> markers, KaCoverageAnalysis analysis) {
    for (KaCoverageGap gap : analysis.gaps()) {
      engine.addKaCoverageGap(gap.id(), gap.start().timestamp(),
          gap.end() == null ? null : gap.end().timestamp(),
          gap.lostSatellite(), gap.regainedSatellite());
      markers.add(marker(MissionMarker.MarkerType.KA_GAP_START, "Ka coverage lost", gap.start(),
          gap.lostSatellite()));
      if (gap.end() != null) {
        markers.add(marker(MissionMarker.MarkerType.KA_GAP_END, "Ka coverage restored", gap.end(),
            gap.regainedSatellite()));
      }
    }
    for (KaCoverageSwap swap : analysis.swaps()) {
      engine.addKaTransition(swap.transitionId(), swap.fromSatellite(), swap.toSatellite(),
          swap.midpoint().timestamp());
      markers.add(marker(MissionMarker.MarkerType.KA_SWAP,
          "Ka swap " + swap.fromSatellite() + " → " + swap.toSatellite(), swap.midpoint(), swap.toSatellite()));
    }
  }

  private Function<String, Optional<Double>> longitudeResolver(Optional<PoiSource> pois) {
    Map<String, Optional<Double>> resolved = new HashMap<>();
    return satelliteId -> resolved.computeIfAbsent(satelliteId, id -> {
      Optional<Double> longitude = satelliteCatalog.longitudeOf(id);
      if (longitude.isEmpty()) {
        Optional<Poi> globalPoi = pois.flatMap(source -> source.findGlobalPoiByName(id));
        longitude = globalPoi.map(Poi::longitude);
      }
      if (longitude.isEmpty()) {
        log.warn("No longitude for X satellite {}, skipping its azimuth checks", id);
      }
      return longitude;
    });
  }

  private static TimelineSummary summarize(
      MissionTimeline timeline,
      Map<Transport, List<TransportInterval>> intervals,
      int sampleCount,
      int sampleInterval,
      long runtimeMs) {
    Map<Transport, TransportState> worst = new EnumMap<>(Transport.class);
    intervals.forEach((transport, list) -> worst.put(transport, list.stream()
        .map(TransportInterval::state)
        .reduce(TransportState.AVAILABLE, TransportState::worst)));
    TimelineStatistics statistics = timeline.statistics();
    return new TimelineSummary(
        timeline.missionId(),
        timeline.window().start(),
        timeline.window().end(),
        statistics.totalSeconds(),
        statistics.degradedSeconds(),
        statistics.criticalSeconds(),
        statistics.nextConflictSeconds(),
        worst,
        sampleCount,
        sampleInterval,
        runtimeMs);
  }

  private static MissionMarker marker(
      MissionMarker.MarkerType type, String label, RouteSample at, String satelliteId) {
    return new MissionMarker(type, label, at.timestamp(), at.latitude(), at.longitude(), satelliteId);
  }
}
