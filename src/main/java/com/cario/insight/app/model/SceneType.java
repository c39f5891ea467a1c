package com.cario.insight.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SceneType {
  INDOOR("indoor"),
  OUTDOOR("outdoor"),
  UNKNOWN("unknown");

  private final String code;

  SceneType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  @JsonCreator
  public static SceneType fromCode(String code) {
    for (SceneType t : values()) {
      if (t.code.equalsIgnoreCase(code)) {
        return t;
      }
    }
    return UNKNOWN;
  }
}
