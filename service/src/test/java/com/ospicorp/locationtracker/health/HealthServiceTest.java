package com.ospicorp.locationtracker.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.locationtracker.store.CredentialStatus;
import com.ospicorp.locationtracker.store.InMemoryCoordinateStore;
import com.ospicorp.locationtracker.store.StoreConnection;
import com.ospicorp.locationtracker.store.StoreException;
import org.junit.jupiter.api.Test;

class HealthServiceTest {

  @Test
  void unconfiguredStoreIsHealthyButNotConfigured() {
    HealthResponse health =
        new HealthService(StoreConnection.unavailable(CredentialStatus.UNCONFIGURED)).check();

    assertThat(health.status()).isEqualTo("healthy");
    assertThat(health.mode()).isEqualTo("development");
    assertThat(health.services().api()).isEqualTo("running");
    assertThat(health.services().dynamodb()).isEqualTo("not_configured");
    assertThat(health.message()).contains("Configure AWS credentials");
  }

  @Test
  void placeholderCredentialsAreCalledOut() {
    HealthResponse health =
        new HealthService(StoreConnection.unavailable(CredentialStatus.INVALID_PLACEHOLDER)).check();

    assertThat(health.services().dynamodb()).isEqualTo("not_configured");
    assertThat(health.message()).contains("placeholders");
  }

  @Test
  void reachableStoreIsConnected() {
    HealthResponse health =
        new HealthService(StoreConnection.connected(new InMemoryCoordinateStore())).check();

    assertThat(health.status()).isEqualTo("healthy");
    assertThat(health.mode()).isEqualTo("production");
    assertThat(health.services().dynamodb()).isEqualTo("connected");
    assertThat(health.message()).isNull();
  }

  @Test
  void failingProbeDegradesStatus() {
    InMemoryCoordinateStore store = new InMemoryCoordinateStore();
    store.failListWith(() -> new StoreException("DynamoDB error: The security token is invalid"));

    HealthResponse health = new HealthService(StoreConnection.connected(store)).check();

    assertThat(health.status()).isEqualTo("degraded");
    assertThat(health.services().api()).isEqualTo("running");
    assertThat(health.services().dynamodb())
        .isEqualTo("error: DynamoDB error: The security token is invalid");
  }
}
