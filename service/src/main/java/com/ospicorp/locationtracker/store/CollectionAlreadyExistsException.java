package com.ospicorp.locationtracker.store;

public class CollectionAlreadyExistsException extends StoreException {

  public CollectionAlreadyExistsException(String message, Throwable cause) {
    super(message, "ResourceInUseException", cause);
  }
}
