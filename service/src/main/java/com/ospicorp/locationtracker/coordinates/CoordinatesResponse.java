package com.ospicorp.locationtracker.coordinates;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CoordinatesResponse(
    @JsonProperty("table_name") String tableName,
    List<Coordinate> coordinates,
    int count,
    DataMode mode,
    String message
) {

  public static CoordinatesResponse of(String tableName, List<Coordinate> coordinates,
      DataMode mode, String message) {
    return new CoordinatesResponse(tableName, List.copyOf(coordinates), coordinates.size(), mode,
        message);
  }
}
