package com.skycomm.planner.coverage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Reads footprints from a GeoJSON FeatureCollection.
 *
 * <p>Each feature carries a {@code satellite_id} property and a Polygon or MultiPolygon geometry.
 * Only exterior rings are used. Several features may share a satellite id. Features without a
 * satellite id or with another geometry type are skipped.
 */
public class GeoJsonCoverageDataSource implements CoverageDataSource {
  private static final Logger log = LoggerFactory.getLogger(GeoJsonCoverageDataSource.class);

  private final Resource resource;
  private final ObjectMapper objectMapper;

  public GeoJsonCoverageDataSource(Resource resource, ObjectMapper objectMapper) {
    this.resource = resource;
    this.objectMapper = objectMapper;
  }

  @Override
  public Map<String, List<CoverageRing>> loadFootprints() {
    JsonNode root;
    try (InputStream in = resource.getInputStream()) {
      root = objectMapper.readTree(in);
    } catch (IOException ex) {
      throw new CoverageDataException("Failed to read coverage dataset " + resource.getDescription(), ex);
    }
    if (root == null || !"FeatureCollection".equals(root.path("type").asText())) {
      throw new CoverageDataException("Coverage dataset is not a GeoJSON FeatureCollection");
    }

    Map<String, List<CoverageRing>> footprints = new LinkedHashMap<>();
    int index = 0;
    for (JsonNode feature : root.path("features")) {
      index++;
      String satelliteId = feature.path("properties").path("satellite_id").asText(null);
      if (satelliteId == null || satelliteId.isBlank()) {
        log.warn("Skipping coverage feature #{} without satellite_id", index);
        continue;
      }
      JsonNode geometry = feature.path("geometry");
      JsonNode coordinates = geometry.path("coordinates");
      String type = geometry.path("type").asText();
      switch (type) {
        case "Polygon" -> footprints.computeIfAbsent(satelliteId, id -> new ArrayList<>())
            .add(toRing(coordinates.path(0), satelliteId));
        case "MultiPolygon" -> {
          List<CoverageRing> rings = footprints.computeIfAbsent(satelliteId, id -> new ArrayList<>());
          for (JsonNode polygon : coordinates) {
            rings.add(toRing(polygon.path(0), satelliteId));
          }
        }
        default -> log.warn("Skipping coverage feature #{} for satellite {}: unsupported geometry '{}'",
            index, satelliteId, type);
      }
    }
    return footprints;
  }

  private static CoverageRing toRing(JsonNode ring, String satelliteId) {
    if (!ring.isArray() || ring.isEmpty()) {
      throw new CoverageDataException("Empty ring for satellite " + satelliteId);
    }
    double[] longitudes = new double[ring.size()];
    double[] latitudes = new double[ring.size()];
    for (int i = 0; i < ring.size(); i++) {
      JsonNode vertex = ring.get(i);
      if (!vertex.path(0).isNumber() || !vertex.path(1).isNumber()) {
        throw new CoverageDataException("Invalid vertex " + vertex + " for satellite " + satelliteId);
      }
      longitudes[i] = vertex.get(0).asDouble();
      latitudes[i] = vertex.get(1).asDouble();
    }
    return new CoverageRing(longitudes, latitudes);
  }
}
