package com.cario.insight.app.model;

/** OCR output. {@code textFound} and {@code wordCount} are derived from the trimmed text. */
public record TextResult(String extractedText, boolean textFound, int wordCount) {

  public static TextResult of(String rawText) {
    String trimmed = rawText == null ? "" : rawText.trim();
    int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    return new TextResult(trimmed, !trimmed.isEmpty(), words);
  }
}
