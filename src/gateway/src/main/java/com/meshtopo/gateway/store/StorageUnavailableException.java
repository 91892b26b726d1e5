package com.meshtopo.gateway.store;

/** Raised when the backing database file cannot be created, opened or initialized. */
public class StorageUnavailableException extends RuntimeException {
  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
