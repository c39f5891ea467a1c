package com.cario.insight.app.model;

import java.util.Objects;

/**
 * Either the value produced by one analyzer or the reason it failed. Aggregation decides what a
 * failure means for the job; analyzers never do.
 */
public record AnalyzerOutcome<T>(AnalyzerKind kind, T value, String error) {

  public static <T> AnalyzerOutcome<T> ok(AnalyzerKind kind, T value) {
    return new AnalyzerOutcome<>(kind, Objects.requireNonNull(value, "value"), null);
  }

  public static <T> AnalyzerOutcome<T> failed(AnalyzerKind kind, String error) {
    return new AnalyzerOutcome<>(kind, null, error == null ? "unknown error" : error);
  }

  public boolean isOk() {
    return error == null;
  }
}
