package com.cario.insight.app.analyzer;

import java.awt.image.BufferedImage;

/** OCR capability behind {@link TextExtractor}. */
public interface OcrEngine {

  /**
   * @return raw recognized text, possibly empty
   * @throws RuntimeException when the engine is unavailable or fails
   */
  String recognize(BufferedImage image);
}
