package com.cario.insight.app.exception;

/** Unknown job id, or a job artifact (original / annotated image) that does not exist. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String message) {
    super(message);
  }
}
