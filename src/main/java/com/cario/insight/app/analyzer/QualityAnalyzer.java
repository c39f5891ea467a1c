package com.cario.insight.app.analyzer;

import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.BlurLevel;
import com.cario.insight.app.model.QualityResult;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.imgproc.Imgproc;

/**
 * Sharpness, blur level, contrast and a combined quality score over the grayscale image.
 *
 * <ul>
 *   <li>sharpness: variance of {@link Imgproc#Laplacian} (64-bit, default aperture and border)
 *   <li>blur: sharpness &lt; {@value #BLUR_HIGH_BELOW} is high, &lt; {@value #BLUR_MEDIUM_BELOW}
 *       medium, otherwise low
 *   <li>contrast: standard deviation of gray intensities
 *   <li>quality: {@code min(sharpness / 10, 100) * 0.6 + min(contrast, 100) * 0.4}, clamped to
 *       [0,100]
 * </ul>
 */
public class QualityAnalyzer implements ImageAnalyzer<QualityResult> {

  public static final double BLUR_HIGH_BELOW = 100.0;
  public static final double BLUR_MEDIUM_BELOW = 500.0;

  public static final double SHARPNESS_NORMALIZER = 10.0;
  public static final double SHARPNESS_WEIGHT = 0.6;
  public static final double CONTRAST_WEIGHT = 0.4;

  @Override
  public AnalyzerKind kind() {
    return AnalyzerKind.QUALITY;
  }

  @Override
  public QualityResult analyze(DecodedImage image) {
    Mat gray = OpenCvMats.gray(image);
    Mat laplacian = new Mat();
    try {
      Imgproc.Laplacian(gray, laplacian, CvType.CV_64F);
      double sharpness = Math.max(0.0, Math.pow(stdDev(laplacian), 2));
      double contrast = stdDev(gray);

      double normalizedSharpness = Math.min(sharpness / SHARPNESS_NORMALIZER, 100.0);
      double normalizedContrast = Math.min(contrast, 100.0);
      double quality =
          clamp(normalizedSharpness * SHARPNESS_WEIGHT + normalizedContrast * CONTRAST_WEIGHT);

      return new QualityResult(
          round2(sharpness), blurLevel(sharpness), round2(contrast), round2(quality));
    } finally {
      OpenCvMats.release(gray, laplacian);
    }
  }

  public static BlurLevel blurLevel(double sharpness) {
    if (sharpness < BLUR_HIGH_BELOW) {
      return BlurLevel.HIGH;
    }
    if (sharpness < BLUR_MEDIUM_BELOW) {
      return BlurLevel.MEDIUM;
    }
    return BlurLevel.LOW;
  }

  private static double stdDev(Mat mat) {
    MatOfDouble mean = new MatOfDouble();
    MatOfDouble std = new MatOfDouble();
    try {
      Core.meanStdDev(mat, mean, std);
      return std.toArray()[0];
    } finally {
      OpenCvMats.release(mean, std);
    }
  }

  private static double clamp(double v) {
    return Math.max(0.0, Math.min(100.0, v));
  }

  private static double round2(double v) {
    return Math.round(v * 100.0) / 100.0;
  }
}
