package com.ospicorp.locationtracker.coordinates;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.locationtracker.config.TrackerProperties;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class MockCoordinateCatalogTest {

  private final MockCoordinateCatalog catalog =
      new MockCoordinateCatalog(MockCoordinateCatalog.defaultTables());

  @Test
  void lookupIgnoresCase() {
    assertThat(catalog.find("BANGALORE")).isPresent();
    assertThat(catalog.find("Test_Table").orElseThrow()).hasSize(5);
    assertThat(catalog.find("coordinates_table").orElseThrow()).hasSize(3);
  }

  @Test
  void unknownAndNullNamesMiss() {
    assertThat(catalog.find("nonexistent_table_12345")).isEmpty();
    assertThat(catalog.find(null)).isEmpty();
  }

  @Test
  void tableNamesKeepDefinitionOrder() {
    assertThat(catalog.tableNames()).containsExactly("test_table", "coordinates_table", "bangalore");
  }

  @Test
  void bangaloreStartsWithThePalace() {
    List<Coordinate> bangalore = catalog.find("bangalore").orElseThrow();
    assertThat(bangalore).hasSize(4);
    assertThat(bangalore.get(0))
        .isEqualTo(new Coordinate("1", "Bangalore Palace", 12.9984, 77.5916));
  }

  @Test
  void disabledCatalogIsEmpty() {
    TrackerProperties properties = new TrackerProperties("1.0.0",
        new TrackerProperties.MockData(false),
        new TrackerProperties.DynamoDb("us-east-1", null, null, null, Duration.ofSeconds(3),
            new TrackerProperties.TableCreation(Duration.ofSeconds(1), 30)));

    MockCoordinateCatalog disabled = new MockCoordinateCatalog(properties);

    assertThat(disabled.tableNames()).isEmpty();
    assertThat(disabled.find("bangalore")).isEmpty();
  }
}
