package com.cario.insight.app.model;

import java.util.List;

/**
 * Dominant colors as {@code #rrggbb} strings ordered by descending cluster population, plus mean
 * luma in [0,255].
 */
public record ColorResult(List<String> dominantColors, int brightness) {

  public ColorResult {
    dominantColors = List.copyOf(dominantColors);
  }
}
