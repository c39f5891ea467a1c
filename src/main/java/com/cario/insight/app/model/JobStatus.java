package com.cario.insight.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an insight record: {@code processing} is the only non-terminal state and a record
 * leaves it exactly once.
 */
public enum JobStatus {
  PROCESSING("processing"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String code;

  JobStatus(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this != PROCESSING;
  }

  @JsonCreator
  public static JobStatus fromCode(String code) {
    for (JobStatus s : values()) {
      if (s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code)) {
        return s;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + code);
  }
}
