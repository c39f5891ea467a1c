package com.cario.insight.app.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.insight.app.TestImages;
import com.cario.insight.app.model.BlurLevel;
import com.cario.insight.app.model.QualityResult;
import org.junit.jupiter.api.Test;

class QualityAnalyzerTest {

  private final QualityAnalyzer analyzer = new QualityAnalyzer();

  @Test
  void solidGrayIsFullyBlurred() {
    QualityResult r = analyzer.analyze(TestImages.decoded(TestImages.solid(32, 32, 0x7F7F7F)));

    assertEquals(0.0, r.sharpnessScore(), 1e-9);
    assertEquals(BlurLevel.HIGH, r.blurLevel());
    assertEquals(0.0, r.contrastScore(), 1e-9);
    assertEquals(0.0, r.qualityScore(), 1e-9);
  }

  @Test
  void checkerboardIsSharpAndHighContrast() {
    QualityResult r = analyzer.analyze(TestImages.decoded(TestImages.checkerboard(8)));

    assertEquals(1020.0 * 1020.0, r.sharpnessScore(), 1e-6);
    assertEquals(BlurLevel.LOW, r.blurLevel());
    assertEquals(127.5, r.contrastScore(), 1e-9);
    assertEquals(100.0, r.qualityScore(), 1e-9);
  }

  @Test
  void qualityStaysWithinBounds() {
    QualityResult r =
        analyzer.analyze(TestImages.decoded(TestImages.stripes(4, 8, 0x101010, 0xA0A0A0)));

    assertTrue(r.qualityScore() >= 0 && r.qualityScore() <= 100);
    assertTrue(r.sharpnessScore() >= 0);
  }

  @Test
  void blurThresholds() {
    assertEquals(BlurLevel.HIGH, QualityAnalyzer.blurLevel(0));
    assertEquals(BlurLevel.HIGH, QualityAnalyzer.blurLevel(99.99));
    assertEquals(BlurLevel.MEDIUM, QualityAnalyzer.blurLevel(100));
    assertEquals(BlurLevel.MEDIUM, QualityAnalyzer.blurLevel(499.99));
    assertEquals(BlurLevel.LOW, QualityAnalyzer.blurLevel(500));
  }

  @Test
  void singlePixelImageHasNoEdges() {
    QualityResult r = analyzer.analyze(TestImages.decoded(TestImages.solid(1, 1, 0xC8C8C8)));

    assertEquals(0.0, r.sharpnessScore(), 1e-9);
    assertEquals(0.0, r.contrastScore(), 1e-9);
  }

  @Test
  void sharperImageScoresHigherThanSoftOne() {
    QualityResult hard =
        analyzer.analyze(
            TestImages.decoded(TestImages.stripes(1, 16, 0x000000, 0xFFFFFF, 0x000000)));
    QualityResult soft =
        analyzer.analyze(
            TestImages.decoded(TestImages.stripes(1, 16, 0x606060, 0x808080, 0x606060)));

    assertTrue(hard.sharpnessScore() > soft.sharpnessScore());
    assertTrue(hard.qualityScore() > soft.qualityScore());
  }
}
