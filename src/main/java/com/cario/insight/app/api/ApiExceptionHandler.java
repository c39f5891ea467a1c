package com.cario.insight.app.api;

import com.cario.insight.app.exception.JobNotFoundException;
import com.cario.insight.app.exception.PipelineException;
import com.cario.insight.app.exception.StorageException;
import com.cario.insight.app.exception.ValidationException;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Maps the error taxonomy onto HTTP status codes with a {@code {"error": ...}} body. */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, String>> validation(ValidationException e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<Map<String, String>> missingPart(Exception e) {
    return error(HttpStatus.BAD_REQUEST, "No image file provided");
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Map<String, String>> tooLarge(MaxUploadSizeExceededException e) {
    return error(HttpStatus.PAYLOAD_TOO_LARGE, "File too large");
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> notFound(JobNotFoundException e) {
    return error(HttpStatus.NOT_FOUND, e.getMessage());
  }

  @ExceptionHandler({StorageException.class, PipelineException.class})
  public ResponseEntity<Map<String, String>> unavailable(RuntimeException e) {
    log.error("api.unavailable msg={}", e.getMessage(), e);
    return error(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, String>> unexpected(Exception e) {
    log.error("api.error msg={}", e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(Map.of("error", message == null ? "" : message));
  }
}
