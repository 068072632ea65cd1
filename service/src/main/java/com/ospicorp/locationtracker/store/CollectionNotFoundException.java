package com.ospicorp.locationtracker.store;

public class CollectionNotFoundException extends StoreException {

  public CollectionNotFoundException(String message, Throwable cause) {
    super(message, "ResourceNotFoundException", cause);
  }
}
