package com.ospicorp.locationtracker;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
    "location-tracker.dynamodb.access-key-id=",
    "location-tracker.dynamodb.secret-access-key="
})
class ApiApplicationSmokeTest {

  @Autowired
  private TestRestTemplate restTemplate;

  @Test
  void rootDescribesEndpoints() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body).containsKeys("message", "version", "endpoints");
    assertThat(body.get("version")).isEqualTo("1.0.0");
    assertThat(body.get("mode")).isEqualTo("development (mock data)");

    @SuppressWarnings("unchecked")
    Map<String, Object> endpoints = (Map<String, Object>) body.get("endpoints");
    assertThat(endpoints).containsEntry("get_coordinates", "/api/coordinates/{table_name}");
    assertThat(endpoints).containsEntry("health", "/api/health");
  }

  @Test
  void healthReportsStoreNotConfigured() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/api/health",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.get("status")).isEqualTo("healthy");
    assertThat(body.get("services"))
        .isEqualTo(Map.of("api", "running", "dynamodb", "not_configured"));
  }

  @Test
  void mockTablesAreListed() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/api/mock-tables",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().get("available_tables"))
        .isEqualTo(List.of("test_table", "coordinates_table", "bangalore"));
  }
}
