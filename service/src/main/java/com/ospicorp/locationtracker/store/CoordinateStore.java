package com.ospicorp.locationtracker.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Thin view of the key-value table store. Every method reports failures as a
 * {@link StoreException}; the subclasses distinguish missing tables, denied access and tables that
 * already exist.
 */
public interface CoordinateStore {

  /** Full scan of {@code collection}, projecting only {@code fields}. */
  List<Map<String, AttributeValue>> scan(String collection, List<String> fields);

  void put(String collection, Map<String, AttributeValue> item);

  /** Creates {@code name} with a single string hash key named {@code keyAttribute}. */
  void createCollection(String name, String keyAttribute);

  /**
   * Blocks until {@code name} exists, polling every {@code pollInterval} at most
   * {@code maxAttempts} times.
   */
  void waitUntilExists(String name, Duration pollInterval, int maxAttempts);

  List<String> listCollections(int limit);
}
