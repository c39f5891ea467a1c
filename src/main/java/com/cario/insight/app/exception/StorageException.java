package com.cario.insight.app.exception;

/** Storage backend failure. Treated as transient and retried unless it is a not-found. */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
