package com.cario.insight.app.exception;

/** Bytes were fetched but do not decode into an image. */
public class DecodeException extends RuntimeException {

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
