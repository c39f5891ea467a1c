package com.cario.insight.app.analyzer;

import com.cario.insight.app.exception.AnalyzerException;
import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.FaceBox;
import com.cario.insight.app.model.FaceResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/** Face boxes in original pixel space. An image without faces yields an empty result. */
@Log4j2
public class FaceDetector implements ImageAnalyzer<FaceResult> {

  private final FaceLocator locator;

  public FaceDetector(FaceLocator locator) {
    this.locator = Objects.requireNonNull(locator, "locator must not be null");
  }

  @Override
  public AnalyzerKind kind() {
    return AnalyzerKind.FACE;
  }

  @Override
  public FaceResult analyze(DecodedImage image) {
    List<FaceBox> raw;
    try {
      raw = locator.locate(image);
    } catch (RuntimeException e) {
      throw new AnalyzerException(kind(), locator.name() + " failed: " + e.getMessage(), e);
    }
    if (raw == null || raw.isEmpty()) {
      return FaceResult.none();
    }

    List<FaceBox> boxes = new ArrayList<>(raw.size());
    for (FaceBox b : raw) {
      FaceBox clipped = clip(b, image.width(), image.height());
      if (clipped != null) {
        boxes.add(clipped);
      }
    }
    log.debug("face.detect locator={} faces={}", locator.name(), boxes.size());
    return new FaceResult(boxes);
  }

  /** Keeps the box inside the image; drops boxes left with no area. */
  static FaceBox clip(FaceBox b, int width, int height) {
    int x0 = Math.max(0, b.x());
    int y0 = Math.max(0, b.y());
    int x1 = Math.min(width, b.x() + b.width());
    int y1 = Math.min(height, b.y() + b.height());
    if (x1 <= x0 || y1 <= y0) {
      return null;
    }
    return new FaceBox(x0, y0, x1 - x0, y1 - y0);
  }
}
