package com.cario.insight.app.analyzer;

import com.cario.insight.app.exception.AnalyzerException;
import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.TextResult;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * OCR over a grayscale, contrast-stretched copy of the image. {@code text_found} and {@code
 * word_count} derive from the trimmed text.
 */
@Log4j2
public class TextExtractor implements ImageAnalyzer<TextResult> {

  private final OcrEngine engine;

  public TextExtractor(OcrEngine engine) {
    this.engine = Objects.requireNonNull(engine, "engine must not be null");
  }

  @Override
  public AnalyzerKind kind() {
    return AnalyzerKind.TEXT;
  }

  @Override
  public TextResult analyze(DecodedImage image) {
    String raw;
    try {
      raw = engine.recognize(preprocess(image));
    } catch (RuntimeException e) {
      throw new AnalyzerException(kind(), "OCR failed: " + e.getMessage(), e);
    }
    TextResult result = TextResult.of(raw);
    log.debug("text.extract found={} words={}", result.textFound(), result.wordCount());
    return result;
  }

  /** 8-bit grayscale with intensities stretched to the full 0..255 range. */
  static BufferedImage preprocess(DecodedImage image) {
    Mat gray = OpenCvMats.gray(image);
    Mat stretched = new Mat();
    try {
      Core.MinMaxLocResult range = Core.minMaxLoc(gray);
      if (range.maxVal > range.minVal) {
        Core.normalize(gray, stretched, 0, 255, Core.NORM_MINMAX);
      } else {
        gray.copyTo(stretched);
      }
      BufferedImage out =
          new BufferedImage(image.width(), image.height(), BufferedImage.TYPE_BYTE_GRAY);
      byte[] pixels = ((DataBufferByte) out.getRaster().getDataBuffer()).getData();
      stretched.get(0, 0, pixels);
      return out;
    } finally {
      OpenCvMats.release(gray, stretched);
    }
  }
}
