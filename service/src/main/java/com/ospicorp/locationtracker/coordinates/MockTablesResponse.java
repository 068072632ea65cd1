package com.ospicorp.locationtracker.coordinates;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record MockTablesResponse(
    @JsonProperty("available_tables") List<String> availableTables,
    String description,
    String note
) {}
