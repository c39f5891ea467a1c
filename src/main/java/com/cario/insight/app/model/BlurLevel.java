package com.cario.insight.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Amount of blur, the inverse of sharpness. */
public enum BlurLevel {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high");

  private final String code;

  BlurLevel(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  @JsonCreator
  public static BlurLevel fromCode(String code) {
    for (BlurLevel b : values()) {
      if (b.code.equalsIgnoreCase(code)) {
        return b;
      }
    }
    throw new IllegalArgumentException("Unknown blur level: " + code);
  }
}
