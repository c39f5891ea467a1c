package com.cario.insight.app.analyzer;

import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.SceneResult;
import com.cario.insight.app.model.SceneType;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Indoor/outdoor guess from HSV statistics (hue on the 0..180 scale, saturation and value on
 * 0..255).
 *
 * <p>Sky-blue or vegetation-green coverage above {@value #COVERAGE_THRESHOLD} means outdoor, with
 * confidence growing with coverage. Dark or desaturated images mean indoor. Anything else is
 * {@code unknown} at confidence {@value #UNKNOWN_CONFIDENCE}.
 */
public class SceneDetector implements ImageAnalyzer<SceneResult> {

  static final double COVERAGE_THRESHOLD = 0.3;
  static final double OUTDOOR_MIN_VALUE = 100;
  static final double DARK_VALUE = 80;
  static final double LOW_SATURATION = 50;
  static final double UNKNOWN_CONFIDENCE = 0.5;

  static final Scalar SKY_LOW = new Scalar(90, 50, 50);
  static final Scalar SKY_HIGH = new Scalar(130, 255, 255);
  static final Scalar GREEN_LOW = new Scalar(35, 50, 50);
  static final Scalar GREEN_HIGH = new Scalar(85, 255, 255);

  @Override
  public AnalyzerKind kind() {
    return AnalyzerKind.SCENE;
  }

  @Override
  public SceneResult analyze(DecodedImage image) {
    Mat hsv = OpenCvMats.hsv(image);
    try {
      double n = (double) hsv.rows() * hsv.cols();
      Scalar mean = Core.mean(hsv);
      double avgSat = mean.val[1];
      double avgVal = mean.val[2];
      double blueRatio = coverage(hsv, SKY_LOW, SKY_HIGH) / n;
      double greenRatio = coverage(hsv, GREEN_LOW, GREEN_HIGH) / n;

      if (blueRatio > COVERAGE_THRESHOLD && avgVal > OUTDOOR_MIN_VALUE) {
        return result(SceneType.OUTDOOR, 0.6 + blueRatio * 0.4);
      }
      if (greenRatio > COVERAGE_THRESHOLD) {
        return result(SceneType.OUTDOOR, 0.6 + greenRatio * 0.4);
      }
      if (avgVal < DARK_VALUE) {
        return result(SceneType.INDOOR, 0.7);
      }
      if (avgSat < LOW_SATURATION) {
        return result(SceneType.INDOOR, 0.6);
      }
      return result(SceneType.UNKNOWN, UNKNOWN_CONFIDENCE);
    } finally {
      hsv.release();
    }
  }

  private static int coverage(Mat hsv, Scalar low, Scalar high) {
    Mat mask = new Mat();
    try {
      Core.inRange(hsv, low, high, mask);
      return Core.countNonZero(mask);
    } finally {
      mask.release();
    }
  }

  private static SceneResult result(SceneType type, double confidence) {
    double c = Math.max(0.0, Math.min(1.0, confidence));
    return new SceneResult(type, Math.round(c * 100.0) / 100.0);
  }
}
