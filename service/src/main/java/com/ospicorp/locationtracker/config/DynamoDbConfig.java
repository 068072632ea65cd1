package com.ospicorp.locationtracker.config;

import com.ospicorp.locationtracker.store.CredentialInspector;
import com.ospicorp.locationtracker.store.CredentialStatus;
import com.ospicorp.locationtracker.store.DynamoDbCoordinateStore;
import com.ospicorp.locationtracker.store.StoreConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class DynamoDbConfig {

  private static final Logger log = LoggerFactory.getLogger(DynamoDbConfig.class);

  @Bean(destroyMethod = "close")
  StoreConnection storeConnection(TrackerProperties properties) {
    TrackerProperties.DynamoDb dynamo = properties.dynamodb();
    CredentialStatus status =
        CredentialInspector.inspect(dynamo.accessKeyId(), dynamo.secretAccessKey());
    switch (status) {
      case CONFIGURED -> {
        log.info("DynamoDB credentials configured; using region {}{}", dynamo.region(),
            hasEndpoint(dynamo) ? " via endpoint " + dynamo.endpoint() : "");
        return StoreConnection.connected(DynamoDbCoordinateStore.create(
            dynamo.region(),
            dynamo.accessKeyId(),
            dynamo.secretAccessKey(),
            dynamo.endpoint(),
            dynamo.healthTimeout()));
      }
      case INVALID_PLACEHOLDER -> log.warn(
          "DynamoDB credentials look like placeholders; serving mock data only");
      default -> log.warn("DynamoDB credentials not configured; serving mock data only");
    }
    return StoreConnection.unavailable(status);
  }

  private static boolean hasEndpoint(TrackerProperties.DynamoDb dynamo) {
    return dynamo.endpoint() != null && !dynamo.endpoint().toString().isBlank();
  }
}
