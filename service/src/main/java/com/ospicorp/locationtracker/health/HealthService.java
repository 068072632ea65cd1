package com.ospicorp.locationtracker.health;

import com.ospicorp.locationtracker.store.CoordinateStore;
import com.ospicorp.locationtracker.store.CredentialStatus;
import com.ospicorp.locationtracker.store.StoreConnection;
import com.ospicorp.locationtracker.store.StoreException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single-attempt liveness probe of the API and its DynamoDB dependency. Never fails; a broken
 * store only degrades the reported status.
 */
@Service
public class HealthService {

  static final String HEALTHY = "healthy";
  static final String DEGRADED = "degraded";
  static final String RUNNING = "running";
  static final String CONNECTED = "connected";
  static final String NOT_CONFIGURED = "not_configured";

  private static final Logger log = LoggerFactory.getLogger(HealthService.class);

  private final StoreConnection connection;

  public HealthService(StoreConnection connection) {
    this.connection = connection;
  }

  public HealthResponse check() {
    Optional<CoordinateStore> store = connection.store();
    if (store.isEmpty()) {
      String message = connection.status() == CredentialStatus.INVALID_PLACEHOLDER
          ? "AWS credentials look like placeholders. Using mock data for development."
          : "Using mock data for development. Configure AWS credentials for production.";
      return new HealthResponse(HEALTHY, connection.mode(),
          new HealthResponse.Services(RUNNING, NOT_CONFIGURED), message);
    }
    try {
      store.get().listCollections(1);
      return new HealthResponse(HEALTHY, connection.mode(),
          new HealthResponse.Services(RUNNING, CONNECTED), null);
    } catch (StoreException ex) {
      log.warn("DynamoDB health probe failed: {}", ex.getMessage());
      return new HealthResponse(DEGRADED, connection.mode(),
          new HealthResponse.Services(RUNNING, "error: " + ex.getMessage()), null);
    }
  }
}
