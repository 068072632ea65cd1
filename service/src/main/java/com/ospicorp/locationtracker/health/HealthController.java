package com.ospicorp.locationtracker.health;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health")
public class HealthController {

  private final HealthService healthService;

  public HealthController(HealthService healthService) {
    this.healthService = healthService;
  }

  @GetMapping("/api/health")
  @Operation(summary = "Health check", description = "Report API and DynamoDB connectivity. Always 200.")
  public HealthResponse health() {
    return healthService.check();
  }
}
