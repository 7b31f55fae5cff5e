package com.skycomm.planner.config;

import com.skycomm.planner.mission.Transport;
import com.skycomm.planner.rules.ConstraintConfig;
import com.skycomm.planner.satellite.Satellite;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the planner service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code planner.*} prefix.
 */
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {
  private final Timeline timeline = new Timeline();
  private final Constraints constraints = new Constraints();
  private final Coverage coverage = new Coverage();
  private final FlightState flightState = new FlightState();
  private final Eta eta = new Eta();
  private List<SatelliteEntry> satellites = defaultSatellites();

  public Timeline getTimeline() {
    return timeline;
  }

  public Constraints getConstraints() {
    return constraints;
  }

  public Coverage getCoverage() {
    return coverage;
  }

  public FlightState getFlightState() {
    return flightState;
  }

  public Eta getEta() {
    return eta;
  }

  public List<SatelliteEntry> getSatellites() {
    return satellites;
  }

  public void setSatellites(List<SatelliteEntry> satellites) {
    this.satellites = satellites;
  }

  public List<Satellite> toSatellites() {
    return satellites.stream()
        .map(entry -> new Satellite(entry.getId(), entry.getTransport(), entry.getLongitude(), entry.getSlot()))
        .toList();
  }

  private static List<SatelliteEntry> defaultSatellites() {
    List<SatelliteEntry> defaults = new ArrayList<>();
    defaults.add(new SatelliteEntry("X-1", Transport.X, null, null));
    defaults.add(new SatelliteEntry("AOR", Transport.KA, -30.0, "Atlantic Ocean Region"));
    defaults.add(new SatelliteEntry("POR", Transport.KA, 154.0, "Pacific Ocean Region"));
    defaults.add(new SatelliteEntry("IOR", Transport.KA, 60.0, "Indian Ocean Region"));
    defaults.add(new SatelliteEntry("Ku-LEO", Transport.KU, null, "LEO constellation"));
    return defaults;
  }

  /** Timeline sampling settings. */
  public static class Timeline {
    private int sampleIntervalSeconds = 60;
    private int sampleWarnThreshold = 2000;
    private long slowBuildWarnMs = 1000;

    public int getSampleIntervalSeconds() {
      return sampleIntervalSeconds;
    }

    public void setSampleIntervalSeconds(int sampleIntervalSeconds) {
      this.sampleIntervalSeconds = sampleIntervalSeconds;
    }

    public int getSampleWarnThreshold() {
      return sampleWarnThreshold;
    }

    public void setSampleWarnThreshold(int sampleWarnThreshold) {
      this.sampleWarnThreshold = sampleWarnThreshold;
    }

    public long getSlowBuildWarnMs() {
      return slowBuildWarnMs;
    }

    public void setSlowBuildWarnMs(long slowBuildWarnMs) {
      this.slowBuildWarnMs = slowBuildWarnMs;
    }
  }

  /** X antenna limits and buffer lengths. */
  public static class Constraints {
    private double normalAzimuthMin = 135.0;
    private double normalAzimuthMax = 225.0;
    private double refuelingAzimuthMin = 315.0;
    private double refuelingAzimuthMax = 45.0;
    private Duration transitionBuffer = Duration.ofMinutes(15);
    private Duration takeoffBuffer = Duration.ofMinutes(15);
    private Duration landingBuffer = Duration.ofMinutes(15);
    private double minimumElevation = 0.0;

    public ConstraintConfig toConstraintConfig() {
      return new ConstraintConfig(
          normalAzimuthMin,
          normalAzimuthMax,
          refuelingAzimuthMin,
          refuelingAzimuthMax,
          transitionBuffer,
          takeoffBuffer,
          landingBuffer,
          minimumElevation);
    }

    public double getNormalAzimuthMin() {
      return normalAzimuthMin;
    }

    public void setNormalAzimuthMin(double normalAzimuthMin) {
      this.normalAzimuthMin = normalAzimuthMin;
    }

    public double getNormalAzimuthMax() {
      return normalAzimuthMax;
    }

    public void setNormalAzimuthMax(double normalAzimuthMax) {
      this.normalAzimuthMax = normalAzimuthMax;
    }

    public double getRefuelingAzimuthMin() {
      return refuelingAzimuthMin;
    }

    public void setRefuelingAzimuthMin(double refuelingAzimuthMin) {
      this.refuelingAzimuthMin = refuelingAzimuthMin;
    }

    public double getRefuelingAzimuthMax() {
      return refuelingAzimuthMax;
    }

    public void setRefuelingAzimuthMax(double refuelingAzimuthMax) {
      this.refuelingAzimuthMax = refuelingAzimuthMax;
    }

    public Duration getTransitionBuffer() {
      return transitionBuffer;
    }

    public void setTransitionBuffer(Duration transitionBuffer) {
      this.transitionBuffer = transitionBuffer;
    }

    public Duration getTakeoffBuffer() {
      return takeoffBuffer;
    }

    public void setTakeoffBuffer(Duration takeoffBuffer) {
      this.takeoffBuffer = takeoffBuffer;
    }

    public Duration getLandingBuffer() {
      return landingBuffer;
    }

    public void setLandingBuffer(Duration landingBuffer) {
      this.landingBuffer = landingBuffer;
    }

    public double getMinimumElevation() {
      return minimumElevation;
    }

    public void setMinimumElevation(double minimumElevation) {
      this.minimumElevation = minimumElevation;
    }
  }

  /** Coverage footprint dataset location. */
  public static class Coverage {
    private boolean enabled = true;
    private String location = "classpath:coverage/ka-footprints.geojson";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getLocation() {
      return location;
    }

    public void setLocation(String location) {
      this.location = location;
    }
  }

  /** Departure/arrival detection thresholds. */
  public static class FlightState {
    private double departureSpeedThresholdKnots = 50.0;
    private Duration departurePersistence = Duration.ofSeconds(10);
    private double arrivalDistanceThresholdMeters = 100.0;
    private Duration arrivalDwell = Duration.ofSeconds(60);
    private long telemetryTickMs = 1000;

    public double getDepartureSpeedThresholdKnots() {
      return departureSpeedThresholdKnots;
    }

    public void setDepartureSpeedThresholdKnots(double departureSpeedThresholdKnots) {
      this.departureSpeedThresholdKnots = departureSpeedThresholdKnots;
    }

    public Duration getDeparturePersistence() {
      return departurePersistence;
    }

    public void setDeparturePersistence(Duration departurePersistence) {
      this.departurePersistence = departurePersistence;
    }

    public double getArrivalDistanceThresholdMeters() {
      return arrivalDistanceThresholdMeters;
    }

    public void setArrivalDistanceThresholdMeters(double arrivalDistanceThresholdMeters) {
      this.arrivalDistanceThresholdMeters = arrivalDistanceThresholdMeters;
    }

    public Duration getArrivalDwell() {
      return arrivalDwell;
    }

    public void setArrivalDwell(Duration arrivalDwell) {
      this.arrivalDwell = arrivalDwell;
    }

    public long getTelemetryTickMs() {
      return telemetryTickMs;
    }

    public void setTelemetryTickMs(long telemetryTickMs) {
      this.telemetryTickMs = telemetryTickMs;
    }
  }

  /** ETA defaults. */
  public static class Eta {
    private double defaultSpeedKnots = 150.0;
    private double passedThresholdMeters = 100.0;
    private Duration speedSmoothingWindow = Duration.ofSeconds(120);

    public double getDefaultSpeedKnots() {
      return defaultSpeedKnots;
    }

    public void setDefaultSpeedKnots(double defaultSpeedKnots) {
      this.defaultSpeedKnots = defaultSpeedKnots;
    }

    public double getPassedThresholdMeters() {
      return passedThresholdMeters;
    }

    public void setPassedThresholdMeters(double passedThresholdMeters) {
      this.passedThresholdMeters = passedThresholdMeters;
    }

    public Duration getSpeedSmoothingWindow() {
      return speedSmoothingWindow;
    }

    public void setSpeedSmoothingWindow(Duration speedSmoothingWindow) {
      this.speedSmoothingWindow = speedSmoothingWindow;
    }
  }

  /** Satellite catalog entry. */
  public static class SatelliteEntry {
    private String id;
    private Transport transport;
    private Double longitude;
    private String slot;

    public SatelliteEntry() {}

    public SatelliteEntry(String id, Transport transport, Double longitude, String slot) {
      this.id = id;
      this.transport = transport;
      this.longitude = longitude;
      this.slot = slot;
    }

    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = id;
    }

    public Transport getTransport() {
      return transport;
    }

    public void setTransport(Transport transport) {
      this.transport = transport;
    }

    public Double getLongitude() {
      return longitude;
    }

    public void setLongitude(Double longitude) {
      this.longitude = longitude;
    }

    public String getSlot() {
      return slot;
    }

    public void setSlot(String slot) {
      this.slot = slot;
    }
  }
}
