package com.cario.insight.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Machine-readable reason attached to a {@code failed} record. */
public enum FailureReason {
  DECODE_ERROR("decode_error"),
  PIPELINE_ERROR("pipeline_error"),
  TIMEOUT("timeout"),
  STORAGE_ERROR("storage_error");

  private final String code;

  FailureReason(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  @JsonCreator
  public static FailureReason fromCode(String code) {
    for (FailureReason r : values()) {
      if (r.code.equalsIgnoreCase(code) || r.name().equalsIgnoreCase(code)) {
        return r;
      }
    }
    throw new IllegalArgumentException("Unknown failure reason: " + code);
  }
}
