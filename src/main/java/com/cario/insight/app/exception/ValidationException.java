package com.cario.insight.app.exception;

/** Rejected upload (bad name, unsupported format, too large). No job is created. */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
