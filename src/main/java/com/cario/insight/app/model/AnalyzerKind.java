package com.cario.insight.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** The closed set of analyzers run against every image. */
public enum AnalyzerKind {
  COLOR("color"),
  QUALITY("quality"),
  FACE("face"),
  TEXT("text"),
  SCENE("scene");

  private final String code;

  AnalyzerKind(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
