package com.ospicorp.locationtracker.coordinates;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestDataResponse(
    String message,
    @JsonProperty("coordinates_added") int coordinatesAdded,
    @JsonProperty("table_name") String tableName,
    DataMode mode,
    @JsonProperty("available_mock_tables") List<String> availableMockTables,
    String note
) {}
