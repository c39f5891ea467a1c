package com.cario.insight.app.exception;

/** Systemic failure of a job, e.g. every analyzer failed. */
public class PipelineException extends RuntimeException {

  public PipelineException(String message) {
    super(message);
  }

  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
