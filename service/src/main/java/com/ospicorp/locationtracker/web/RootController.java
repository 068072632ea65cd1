package com.ospicorp.locationtracker.web;

import com.ospicorp.locationtracker.config.TrackerProperties;
import com.ospicorp.locationtracker.store.StoreConnection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

  private final TrackerProperties properties;
  private final StoreConnection connection;

  public RootController(TrackerProperties properties, StoreConnection connection) {
    this.properties = properties;
    this.connection = connection;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("get_coordinates", "/api/coordinates/{table_name}");
    endpoints.put("create_test_data", "/api/test-data/{table_name}");
    endpoints.put("health", "/api/health");
    endpoints.put("mock_tables", "/api/mock-tables");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", "Location Tracker API is running");
    body.put("version", properties.version());
    body.put("mode", connection.isAvailable() ? "production" : "development (mock data)");
    body.put("endpoints", endpoints);
    return body;
  }
}
