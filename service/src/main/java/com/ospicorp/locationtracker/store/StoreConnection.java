package com.ospicorp.locationtracker.store;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outcome of the startup credential check: the credential state and, only when the credentials
 * look real, the store to talk to. Built once and shared by every request.
 */
public final class StoreConnection implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(StoreConnection.class);

  private final CredentialStatus status;
  private final CoordinateStore store;

  private StoreConnection(CredentialStatus status, CoordinateStore store) {
    this.status = Objects.requireNonNull(status, "status");
    this.store = store;
  }

  public static StoreConnection connected(CoordinateStore store) {
    return new StoreConnection(CredentialStatus.CONFIGURED, Objects.requireNonNull(store, "store"));
  }

  public static StoreConnection unavailable(CredentialStatus status) {
    if (status == CredentialStatus.CONFIGURED) {
      throw new IllegalArgumentException("A configured connection needs a store");
    }
    return new StoreConnection(status, null);
  }

  public CredentialStatus status() {
    return status;
  }

  public boolean isAvailable() {
    return store != null;
  }

  public Optional<CoordinateStore> store() {
    return Optional.ofNullable(store);
  }

  public String mode() {
    return isAvailable() ? "production" : "development";
  }

  @Override
  public void close() {
    if (store instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close coordinate store: {}", ex.getMessage());
      }
    }
  }
}
