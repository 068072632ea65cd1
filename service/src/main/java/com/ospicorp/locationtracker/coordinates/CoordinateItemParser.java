package com.ospicorp.locationtracker.coordinates;

import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Maps DynamoDB items to {@link Coordinate}s. Missing attributes fall back to defaults; a numeric
 * attribute that does not parse makes the whole item invalid.
 */
final class CoordinateItemParser {

  static final String ID = "id";
  static final String TITLE = "title";
  static final String LATITUDE = "latitude";
  static final String LONGITUDE = "longitude";
  static final List<String> PROJECTION = List.of(ID, TITLE, LATITUDE, LONGITUDE);

  private CoordinateItemParser() {
  }

  static Coordinate parse(Map<String, AttributeValue> item) {
    return new Coordinate(
        string(item, ID, ""),
        string(item, TITLE, "Untitled"),
        number(item, LATITUDE),
        number(item, LONGITUDE));
  }

  static Map<String, AttributeValue> toItem(Coordinate coordinate) {
    return Map.of(
        ID, AttributeValue.builder().s(coordinate.id()).build(),
        TITLE, AttributeValue.builder().s(coordinate.title()).build(),
        LATITUDE, AttributeValue.builder().n(Double.toString(coordinate.latitude())).build(),
        LONGITUDE, AttributeValue.builder().n(Double.toString(coordinate.longitude())).build());
  }

  private static String string(Map<String, AttributeValue> item, String name, String fallback) {
    AttributeValue value = item.get(name);
    if (value == null || value.s() == null) {
      return fallback;
    }
    return value.s();
  }

  private static double number(Map<String, AttributeValue> item, String name) {
    AttributeValue value = item.get(name);
    if (value == null || value.n() == null) {
      return 0d;
    }
    try {
      return Double.parseDouble(value.n().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          "Attribute '" + name + "' is not a number: " + value.n(), ex);
    }
  }
}
