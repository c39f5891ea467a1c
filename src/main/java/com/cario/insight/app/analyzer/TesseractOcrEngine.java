package com.cario.insight.app.analyzer;

import java.awt.image.BufferedImage;
import lombok.extern.log4j.Log4j2;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

/**
 * Tess4J adapter. {@link Tesseract} keeps a native handle per instance, so every call gets its own
 * instance.
 */
@Log4j2
public class TesseractOcrEngine implements OcrEngine {

  private final String dataPath;
  private final String language;

  public TesseractOcrEngine(String dataPath, String language) {
    this.dataPath = dataPath;
    this.language = (language == null || language.isBlank()) ? "eng" : language;
    log.info("ocr.tesseract dataPath={} language={}", dataPath, this.language);
  }

  @Override
  public String recognize(BufferedImage image) {
    Tesseract t = new Tesseract();
    if (dataPath != null && !dataPath.isBlank()) {
      t.setDatapath(dataPath);
    }
    t.setLanguage(language);
    t.setVariable("user_defined_dpi", "300");
    try {
      return t.doOCR(image);
    } catch (TesseractException e) {
      throw new IllegalStateException("Tesseract OCR failed: " + e.getMessage(), e);
    }
  }
}
