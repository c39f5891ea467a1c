package com.cario.insight.app.analyzer;

import com.cario.insight.app.model.AnalyzerKind;

/**
 * One category of insight computed from a decoded image.
 *
 * <p>Implementations are stateless between invocations and never modify the image, so they may run
 * concurrently for the same or different images.
 *
 * @param <R> partial result type
 */
public interface ImageAnalyzer<R> {

  AnalyzerKind kind();

  /**
   * @throws com.cario.insight.app.exception.AnalyzerException when the capability fails
   * @throws com.cario.insight.app.exception.DecodeException when the image content is unusable
   */
  R analyze(DecodedImage image);
}
