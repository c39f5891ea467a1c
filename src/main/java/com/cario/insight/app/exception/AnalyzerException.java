package com.cario.insight.app.exception;

import com.cario.insight.app.model.AnalyzerKind;
import lombok.Getter;

/**
 * Failure of a single analyzer capability. The orchestrator absorbs it and degrades the insights
 * payload instead of failing the job.
 */
@Getter
public class AnalyzerException extends RuntimeException {

  private final AnalyzerKind analyzer;

  public AnalyzerException(AnalyzerKind analyzer, String message) {
    super(analyzer + ": " + message);
    this.analyzer = analyzer;
  }

  public AnalyzerException(AnalyzerKind analyzer, String message, Throwable cause) {
    super(analyzer + ": " + message, cause);
    this.analyzer = analyzer;
  }
}
