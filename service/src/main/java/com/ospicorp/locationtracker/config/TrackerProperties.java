package com.ospicorp.locationtracker.config;

import java.net.URI;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("location-tracker")
public record TrackerProperties(
    @DefaultValue("1.0.0") String version,
    @DefaultValue MockData mockData,
    @DefaultValue DynamoDb dynamodb
) {

  public record MockData(@DefaultValue("true") boolean enabled) {}

  public record DynamoDb(
      @DefaultValue("us-east-1") String region,
      String accessKeyId,
      String secretAccessKey,
      URI endpoint,
      @DefaultValue("3s") Duration healthTimeout,
      @DefaultValue TableCreation tableCreation
  ) {}

  public record TableCreation(
      @DefaultValue("1s") Duration pollInterval,
      @DefaultValue("30") int maxAttempts
  ) {}
}
