package com.ospicorp.locationtracker.store;

/**
 * Raised by {@link CoordinateStore} for store failures that have no more specific type.
 */
public class StoreException extends RuntimeException {
  private final String errorCode;

  public StoreException(String message, String errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public StoreException(String message) {
    this(message, null, null);
  }

  public String errorCode() {
    return errorCode;
  }
}
