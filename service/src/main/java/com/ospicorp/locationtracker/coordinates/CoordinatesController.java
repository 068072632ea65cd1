package com.ospicorp.locationtracker.coordinates;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Coordinates")
public class CoordinatesController {

  private final CoordinateService service;

  public CoordinatesController(CoordinateService service) {
    this.service = service;
  }

  @GetMapping("/coordinates/{tableName}")
  @Operation(summary = "Get coordinates",
      description = "Scan a DynamoDB table for coordinates, falling back to mock data when the store is unavailable.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Coordinates",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = CoordinatesResponse.class))),
      @ApiResponse(responseCode = "403", description = "Access denied by DynamoDB",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Table not found and no mock data",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "500", description = "DynamoDB error",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CoordinatesResponse getCoordinates(@PathVariable
      @Parameter(description = "DynamoDB table name", example = "bangalore") String tableName) {
    return service.getCoordinates(tableName);
  }

  @PostMapping("/test-data/{tableName}")
  @Operation(summary = "Create test data",
      description = "Create the table if needed and write five San Francisco sample coordinates.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Sample data written, or mock mode notice",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TestDataResponse.class))),
      @ApiResponse(responseCode = "403", description = "Access denied by DynamoDB",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "500", description = "DynamoDB error",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public TestDataResponse createTestData(@PathVariable
      @Parameter(description = "DynamoDB table name", example = "test_coordinates_table") String tableName) {
    return service.createTestData(tableName);
  }

  @GetMapping("/mock-tables")
  @Operation(summary = "List mock tables")
  public MockTablesResponse mockTables() {
    return service.mockTables();
  }
}
