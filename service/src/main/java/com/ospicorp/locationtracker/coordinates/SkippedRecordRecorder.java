package com.ospicorp.locationtracker.coordinates;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Emits one diagnostic event per scanned item dropped because it could not be parsed. */
@Component
public class SkippedRecordRecorder {

  static final String METRIC = "coordinates.records.skipped";

  private static final Logger log = LoggerFactory.getLogger(SkippedRecordRecorder.class);

  private final MeterRegistry registry;

  public SkippedRecordRecorder(MeterRegistry registry) {
    this.registry = registry;
  }

  public void skipped(String tableName, Map<String, AttributeValue> item, Exception cause) {
    log.warn("Skipping unparsable item in table {}: item={} reason={}",
        tableName, item, cause.getMessage());
    Counter.builder(METRIC)
        .description("Scanned coordinate items dropped because they could not be parsed")
        .tag("table", tableName)
        .register(registry)
        .increment();
  }

  double count(String tableName) {
    Counter counter = registry.find(METRIC).tag("table", tableName).counter();
    return counter != null ? counter.count() : 0d;
  }
}
