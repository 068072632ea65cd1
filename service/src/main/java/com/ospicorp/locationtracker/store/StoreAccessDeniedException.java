package com.ospicorp.locationtracker.store;

public class StoreAccessDeniedException extends StoreException {

  public StoreAccessDeniedException(String message, Throwable cause) {
    super(message, "AccessDeniedException", cause);
  }
}
