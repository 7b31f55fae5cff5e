package com.skycomm.planner.flight;

import com.skycomm.planner.config.PlannerProperties;
import com.skycomm.planner.route.ParsedRoute;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide flight phase tracker.
 *
 * <p>The phase moves forward automatically: {@code PRE_DEPARTURE} to {@code IN_FLIGHT} once speed
 * has stayed above the departure threshold for the persistence duration, {@code IN_FLIGHT} to
 * {@code POST_ARRIVAL} once the aircraft has stayed within the arrival distance for the dwell
 * duration. Manual transitions may go to any phase.
 *
 * <p>All mutation goes through a single lock; readers get immutable {@link FlightStatus}
 * snapshots.
 */
@Component
public class FlightStateManager {
  private static final Logger log = LoggerFactory.getLogger(FlightStateManager.class);

  private final Clock clock;
  private final double departureSpeedThresholdKnots;
  private final Duration departurePersistence;
  private final double arrivalDistanceThresholdMeters;
  private final Duration arrivalDwell;
  private final ReentrantLock lock = new ReentrantLock();
  private final List<FlightPhaseListener> listeners = new CopyOnWriteArrayList<>();

  private FlightPhase phase = FlightPhase.PRE_DEPARTURE;
  private Instant departureTime;
  private Instant arrivalTime;
  private Instant aboveThresholdSince;
  private Instant arrivalDwellSince;
  private Double arrivalDistanceAtDwellStart;
  private double speedPersistenceSeconds;
  private double arrivalDwellSeconds;
  private Instant lastDepartureCheck;
  private Instant lastArrivalCheck;
  private String activeRouteId;
  private String activeRouteName;
  private boolean hasTimingData;
  private Instant scheduledDepartureTime;
  private Instant scheduledArrivalTime;
  private ParsedRoute activeRoute;

  public FlightStateManager(PlannerProperties properties, Clock clock) {
    PlannerProperties.FlightState settings = properties.getFlightState();
    this.clock = clock;
    this.departureSpeedThresholdKnots = settings.getDepartureSpeedThresholdKnots();
    this.departurePersistence = settings.getDeparturePersistence();
    this.arrivalDistanceThresholdMeters = settings.getArrivalDistanceThresholdMeters();
    this.arrivalDwell = settings.getArrivalDwell();
  }

  public void addListener(FlightPhaseListener listener) {
    listeners.add(Objects.requireNonNull(listener));
  }

  /**
   * Returns a snapshot with departure countdowns computed against the current clock.
   */
  public FlightStatus getStatus() {
    lock.lock();
    try {
      Instant now = clock.instant();
      Long untilDeparture = null;
      Long sinceDeparture = null;
      if (departureTime != null) {
        untilDeparture = 0L;
        sinceDeparture = Duration.between(departureTime, now).getSeconds();
      } else if (scheduledDepartureTime != null) {
        untilDeparture = Duration.between(now, scheduledDepartureTime).getSeconds();
      }
      return new FlightStatus(
          phase,
          phase.etaMode(),
          departureTime,
          arrivalTime,
          speedPersistenceSeconds,
          arrivalDwellSeconds,
          activeRouteId,
          activeRouteName,
          hasTimingData,
          scheduledDepartureTime,
          scheduledArrivalTime,
          untilDeparture,
          sinceDeparture,
          lastDepartureCheck,
          lastArrivalCheck,
          now);
    } finally {
      lock.unlock();
    }
  }

  public FlightPhase currentPhase() {
    lock.lock();
    try {
      return phase;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Feeds one ground-speed reading to departure detection. Ignored outside {@code PRE_DEPARTURE}
   * and for non-finite speeds.
   *
   * @param speedKnots ground speed
   * @return true when this reading declared departure
   */
  public boolean checkDeparture(double speedKnots) {
    FlightPhase previous;
    lock.lock();
    try {
      if (phase != FlightPhase.PRE_DEPARTURE) {
        return false;
      }
      if (!Double.isFinite(speedKnots)) {
        log.warn("Ignoring non-finite speed {} for departure detection", speedKnots);
        return false;
      }
      Instant now = clock.instant();
      lastDepartureCheck = now;
      if (speedKnots <= departureSpeedThresholdKnots) {
        if (aboveThresholdSince != null) {
          log.debug("Speed {} kn dropped below {} kn, departure timer reset",
              speedKnots, departureSpeedThresholdKnots);
        }
        aboveThresholdSince = null;
        speedPersistenceSeconds = 0.0;
        return false;
      }
      if (aboveThresholdSince == null) {
        aboveThresholdSince = now;
      }
      speedPersistenceSeconds = seconds(Duration.between(aboveThresholdSince, now));
      if (speedPersistenceSeconds < seconds(departurePersistence)) {
        return false;
      }
      if (departureTime == null) {
        departureTime = now;
      }
      previous = moveTo(FlightPhase.IN_FLIGHT);
    } finally {
      lock.unlock();
    }
    String reason = String.format("speed above %.0f kn for %.0f s", departureSpeedThresholdKnots,
        seconds(departurePersistence));
    notifyListeners(previous, FlightPhase.IN_FLIGHT, reason);
    return true;
  }

  /**
   * Feeds one distance-to-destination reading to arrival detection. Ignored outside
   * {@code IN_FLIGHT} and for non-finite distances.
   *
   * @param distanceMeters distance to the destination
   * @param speedKnots current ground speed, logged with the decision
   * @return true when this reading declared arrival
   */
  public boolean checkArrival(double distanceMeters, double speedKnots) {
    FlightPhase previous;
    lock.lock();
    try {
      if (phase != FlightPhase.IN_FLIGHT) {
        return false;
      }
      if (!Double.isFinite(distanceMeters)) {
        log.warn("Ignoring non-finite distance {} for arrival detection", distanceMeters);
        return false;
      }
      Instant now = clock.instant();
      lastArrivalCheck = now;
      if (distanceMeters > arrivalDistanceThresholdMeters) {
        arrivalDwellSince = null;
        arrivalDistanceAtDwellStart = null;
        arrivalDwellSeconds = 0.0;
        return false;
      }
      if (arrivalDwellSince == null) {
        arrivalDwellSince = now;
        arrivalDistanceAtDwellStart = distanceMeters;
      }
      arrivalDwellSeconds = seconds(Duration.between(arrivalDwellSince, now));
      if (arrivalDwellSeconds < seconds(arrivalDwell)) {
        return false;
      }
      log.debug("Arrival dwell complete: {} m at dwell start, {} m now, {} kn",
          arrivalDistanceAtDwellStart, distanceMeters, speedKnots);
      if (arrivalTime == null) {
        arrivalTime = now;
      }
      previous = moveTo(FlightPhase.POST_ARRIVAL);
    } finally {
      lock.unlock();
    }
    notifyListeners(previous, FlightPhase.POST_ARRIVAL, "within destination for dwell period");
    return true;
  }

  /**
   * Moves to any phase.
   *
   * @return false when already in that phase
   */
  public boolean transitionPhase(FlightPhase target, String reason) {
    Objects.requireNonNull(target, "target");
    FlightPhase previous;
    lock.lock();
    try {
      if (phase == target) {
        return false;
      }
      Instant now = clock.instant();
      switch (target) {
        case PRE_DEPARTURE -> {
          departureTime = null;
          arrivalTime = null;
        }
        case IN_FLIGHT -> {
          if (departureTime == null) {
            departureTime = now;
          }
          arrivalTime = null;
        }
        case POST_ARRIVAL -> {
          if (arrivalTime == null) {
            arrivalTime = now;
          }
        }
      }
      clearTimers();
      previous = moveTo(target);
    } finally {
      lock.unlock();
    }
    notifyListeners(previous, target, reason);
    return true;
  }

  /**
   * Declares departure, optionally at an explicit time.
   *
   * @param at departure time, or {@code null} for now
   */
  public FlightStatus triggerDeparture(Instant at, String reason) {
    FlightPhase previous;
    lock.lock();
    try {
      departureTime = at != null ? at : clock.instant();
      arrivalTime = null;
      clearTimers();
      previous = moveTo(FlightPhase.IN_FLIGHT);
    } finally {
      lock.unlock();
    }
    if (previous != FlightPhase.IN_FLIGHT) {
      notifyListeners(previous, FlightPhase.IN_FLIGHT, reason);
    }
    return getStatus();
  }

  /**
   * Declares arrival, optionally at an explicit time. A missing departure time is set to the
   * arrival time.
   *
   * @param at arrival time, or {@code null} for now
   */
  public FlightStatus triggerArrival(Instant at, String reason) {
    FlightPhase previous;
    lock.lock();
    try {
      arrivalTime = at != null ? at : clock.instant();
      if (departureTime == null) {
        departureTime = arrivalTime;
      }
      clearTimers();
      previous = moveTo(FlightPhase.POST_ARRIVAL);
    } finally {
      lock.unlock();
    }
    if (previous != FlightPhase.POST_ARRIVAL) {
      notifyListeners(previous, FlightPhase.POST_ARRIVAL, reason);
    }
    return getStatus();
  }

  /**
   * Returns to {@code PRE_DEPARTURE} and clears departure, arrival and detection timers. Route
   * context is kept.
   */
  public FlightStatus reset(String reason) {
    FlightPhase previous;
    lock.lock();
    try {
      previous = resetLocked();
    } finally {
      lock.unlock();
    }
    if (previous != FlightPhase.PRE_DEPARTURE) {
      notifyListeners(previous, FlightPhase.PRE_DEPARTURE, reason);
    }
    return getStatus();
  }

  /**
   * Records the active route. When the route identity changes and {@code autoReset} is set, the
   * flight is reset to {@code PRE_DEPARTURE}; startup synchronization passes {@code false}.
   */
  public FlightStatus updateRouteContext(ParsedRoute route, boolean autoReset, String reason) {
    Objects.requireNonNull(route, "route");
    FlightPhase previous = null;
    lock.lock();
    try {
      boolean changed = !Objects.equals(activeRouteId, route.id());
      activeRoute = route;
      activeRouteId = route.id();
      activeRouteName = route.name();
      hasTimingData = route.hasTimingData();
      scheduledDepartureTime = route.timing().departureTime();
      scheduledArrivalTime = route.timing().arrivalTime();
      if (changed && autoReset) {
        log.info("Active route changed to {}, resetting flight state", route.id());
        previous = resetLocked();
      }
    } finally {
      lock.unlock();
    }
    if (previous != null && previous != FlightPhase.PRE_DEPARTURE) {
      notifyListeners(previous, FlightPhase.PRE_DEPARTURE, reason);
    }
    return getStatus();
  }

  public FlightStatus clearRouteContext() {
    lock.lock();
    try {
      activeRoute = null;
      activeRouteId = null;
      activeRouteName = null;
      hasTimingData = false;
      scheduledDepartureTime = null;
      scheduledArrivalTime = null;
    } finally {
      lock.unlock();
    }
    return getStatus();
  }

  /** Active route, if any. Routes are immutable, so the reference can be shared. */
  public Optional<ParsedRoute> activeRoute() {
    lock.lock();
    try {
      return Optional.ofNullable(activeRoute);
    } finally {
      lock.unlock();
    }
  }

  private FlightPhase resetLocked() {
    departureTime = null;
    arrivalTime = null;
    clearTimers();
    lastDepartureCheck = null;
    lastArrivalCheck = null;
    return moveTo(FlightPhase.PRE_DEPARTURE);
  }

  private FlightPhase moveTo(FlightPhase target) {
    FlightPhase previous = phase;
    phase = target;
    if (previous != target) {
      log.info("Flight phase {} -> {} (eta mode {})", previous, target, target.etaMode());
    }
    return previous;
  }

  private void clearTimers() {
    aboveThresholdSince = null;
    arrivalDwellSince = null;
    arrivalDistanceAtDwellStart = null;
    speedPersistenceSeconds = 0.0;
    arrivalDwellSeconds = 0.0;
  }

  private void notifyListeners(FlightPhase previous, FlightPhase current, String reason) {
    for (FlightPhaseListener listener : listeners) {
      try {
        listener.onPhaseChange(previous, current, reason);
      } catch (RuntimeException ex) {
        log.warn("Flight phase listener failed: {}", ex.getMessage(), ex);
      }
    }
  }

  private static double seconds(Duration duration) {
    return duration.toMillis() / 1000.0;
  }
}
