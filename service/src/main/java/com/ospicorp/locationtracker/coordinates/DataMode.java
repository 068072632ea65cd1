package com.ospicorp.locationtracker.coordinates;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which code path produced a coordinates response. */
public enum DataMode {
  MOCK_DATA("mock_data"),
  MOCK_FALLBACK("mock_fallback"),
  ERROR_FALLBACK("error_fallback"),
  PRODUCTION("production");

  private final String code;

  DataMode(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
