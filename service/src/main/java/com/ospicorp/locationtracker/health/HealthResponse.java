package com.ospicorp.locationtracker.health;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(String status, String mode, Services services, String message) {

  public record Services(String api, String dynamodb) {}
}
