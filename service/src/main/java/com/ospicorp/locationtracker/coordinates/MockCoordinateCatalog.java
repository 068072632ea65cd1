package com.ospicorp.locationtracker.coordinates;

import com.ospicorp.locationtracker.config.TrackerProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fixed coordinate tables served when DynamoDB is unavailable or a table is missing there.
 * Lookups ignore case. Empty when {@code location-tracker.mock-data.enabled=false}.
 */
@Component
public class MockCoordinateCatalog {

  private static final Logger log = LoggerFactory.getLogger(MockCoordinateCatalog.class);

  private final Map<String, List<Coordinate>> tables;

  @Autowired
  public MockCoordinateCatalog(TrackerProperties properties) {
    this(properties.mockData().enabled() ? defaultTables() : Map.of());
    if (!properties.mockData().enabled()) {
      log.info("Mock coordinate data disabled via location-tracker.mock-data.enabled=false");
    }
  }

  MockCoordinateCatalog(Map<String, List<Coordinate>> tables) {
    Map<String, List<Coordinate>> copy = new LinkedHashMap<>();
    tables.forEach((name, coordinates) ->
        copy.put(name.toLowerCase(Locale.ROOT), List.copyOf(coordinates)));
    this.tables = Collections.unmodifiableMap(copy);
  }

  public Optional<List<Coordinate>> find(String tableName) {
    if (tableName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(tables.get(tableName.toLowerCase(Locale.ROOT)));
  }

  public List<String> tableNames() {
    return List.copyOf(tables.keySet());
  }

  static Map<String, List<Coordinate>> defaultTables() {
    Map<String, List<Coordinate>> tables = new LinkedHashMap<>();
    tables.put("test_table", List.of(
        new Coordinate("1", "Golden Gate Bridge", 37.8199, -122.4783),
        new Coordinate("2", "Alcatraz Island", 37.8267, -122.4233),
        new Coordinate("3", "Fisherman's Wharf", 37.8080, -122.4177),
        new Coordinate("4", "Lombard Street", 37.8021, -122.4187),
        new Coordinate("5", "Union Square", 37.7880, -122.4074)));
    tables.put("coordinates_table", List.of(
        new Coordinate("1", "San Francisco City Hall", 37.7793, -122.4192),
        new Coordinate("2", "Golden Gate Park", 37.7694, -122.4862),
        new Coordinate("3", "Coit Tower", 37.8024, -122.4058)));
    tables.put("bangalore", List.of(
        new Coordinate("1", "Bangalore Palace", 12.9984, 77.5916),
        new Coordinate("2", "Lalbagh Botanical Garden", 12.9507, 77.5848),
        new Coordinate("3", "Cubbon Park", 12.9716, 77.5946),
        new Coordinate("4", "UB City Mall", 12.9719, 77.6068)));
    return tables;
  }
}
