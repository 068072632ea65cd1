package com.ospicorp.locationtracker.coordinates;

import com.ospicorp.locationtracker.config.TrackerProperties;
import com.ospicorp.locationtracker.store.CollectionAlreadyExistsException;
import com.ospicorp.locationtracker.store.CollectionNotFoundException;
import com.ospicorp.locationtracker.store.CoordinateStore;
import com.ospicorp.locationtracker.store.StoreAccessDeniedException;
import com.ospicorp.locationtracker.store.StoreConnection;
import com.ospicorp.locationtracker.store.StoreException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@Service
public class CoordinateService {

  private static final Logger log = LoggerFactory.getLogger(CoordinateService.class);

  private static final String CONFIGURE_NOTE = "Configure AWS credentials to create real DynamoDB tables";

  private final StoreConnection connection;
  private final MockCoordinateCatalog catalog;
  private final SkippedRecordRecorder skippedRecords;
  private final Duration pollInterval;
  private final int maxAttempts;

  @Autowired
  public CoordinateService(StoreConnection connection, MockCoordinateCatalog catalog,
      SkippedRecordRecorder skippedRecords, TrackerProperties properties) {
    this(connection, catalog, skippedRecords,
        properties.dynamodb().tableCreation().pollInterval(),
        properties.dynamodb().tableCreation().maxAttempts());
  }

  CoordinateService(StoreConnection connection, MockCoordinateCatalog catalog,
      SkippedRecordRecorder skippedRecords, Duration pollInterval, int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.connection = connection;
    this.catalog = catalog;
    this.skippedRecords = skippedRecords;
    this.pollInterval = pollInterval;
    this.maxAttempts = maxAttempts;
  }

  public CoordinatesResponse getCoordinates(String tableName) {
    Optional<CoordinateStore> store = connection.store();
    if (store.isEmpty()) {
      return catalog.find(tableName)
          .map(coordinates -> CoordinatesResponse.of(tableName, coordinates, DataMode.MOCK_DATA,
              "Using mock data. Configure AWS credentials for real DynamoDB access."))
          .orElseGet(() -> CoordinatesResponse.of(tableName, List.of(), DataMode.MOCK_DATA,
              "No mock data available for table '" + tableName + "'. Available tables: "
                  + catalog.tableNames()));
    }

    try {
      return CoordinatesResponse.of(tableName, scan(store.get(), tableName), DataMode.PRODUCTION,
          null);
    } catch (CollectionNotFoundException ex) {
      log.info("Table {} not found in DynamoDB", tableName);
      return catalog.find(tableName)
          .map(coordinates -> CoordinatesResponse.of(tableName, coordinates,
              DataMode.MOCK_FALLBACK,
              "DynamoDB table '" + tableName + "' not found. Using mock data instead."))
          .orElseThrow(() -> new NoSuchElementException("Table '" + tableName
              + "' not found in DynamoDB and no mock data available"));
    } catch (StoreAccessDeniedException ex) {
      throw ex;
    } catch (StoreException ex) {
      Optional<List<Coordinate>> fallback = catalog.find(tableName);
      if (fallback.isEmpty()) {
        throw ex;
      }
      log.warn("Reading table {} failed, serving mock data: {}", tableName, ex.getMessage());
      return CoordinatesResponse.of(tableName, fallback.get(), DataMode.ERROR_FALLBACK,
          "Error accessing DynamoDB. Using mock data instead. Error: " + ex.getMessage());
    }
  }

  public TestDataResponse createTestData(String tableName) {
    Optional<CoordinateStore> store = connection.store();
    if (store.isEmpty()) {
      return new TestDataResponse("Mock mode active - no DynamoDB operations performed", 0,
          tableName, DataMode.MOCK_DATA, catalog.tableNames(), CONFIGURE_NOTE);
    }

    CoordinateStore dynamo = store.get();
    ensureTable(dynamo, tableName);
    for (Coordinate coordinate : SampleCoordinates.SAN_FRANCISCO) {
      dynamo.put(tableName, CoordinateItemParser.toItem(coordinate));
    }
    int added = SampleCoordinates.SAN_FRANCISCO.size();
    log.info("Wrote {} sample coordinates to table {}", added, tableName);
    return new TestDataResponse("Successfully created test data in table '" + tableName + "'",
        added, tableName, DataMode.PRODUCTION, null, null);
  }

  public MockTablesResponse mockTables() {
    return new MockTablesResponse(catalog.tableNames(),
        "Mock data tables available for testing",
        "Configure AWS credentials to use real DynamoDB tables");
  }

  private List<Coordinate> scan(CoordinateStore store, String tableName) {
    List<Map<String, AttributeValue>> items = store.scan(tableName, CoordinateItemParser.PROJECTION);
    List<Coordinate> coordinates = new ArrayList<>(items.size());
    for (Map<String, AttributeValue> item : items) {
      try {
        coordinates.add(CoordinateItemParser.parse(item));
      } catch (IllegalArgumentException ex) {
        skippedRecords.skipped(tableName, item, ex);
      }
    }
    return coordinates;
  }

  private void ensureTable(CoordinateStore store, String tableName) {
    try {
      store.createCollection(tableName, CoordinateItemParser.ID);
    } catch (CollectionAlreadyExistsException ex) {
      log.debug("Table {} already exists", tableName);
    }
    store.waitUntilExists(tableName, pollInterval, maxAttempts);
  }
}
