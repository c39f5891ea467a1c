package com.cario.insight.app.exception;

/** The requested storage key does not exist. Never retried. */
public class StorageNotFoundException extends StorageException {

  public StorageNotFoundException(String key) {
    super("No object stored under key " + key);
  }
}
