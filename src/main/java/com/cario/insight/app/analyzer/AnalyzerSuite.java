package com.cario.insight.app.analyzer;

import com.cario.insight.app.model.ColorResult;
import com.cario.insight.app.model.FaceResult;
import com.cario.insight.app.model.QualityResult;
import com.cario.insight.app.model.SceneResult;
import com.cario.insight.app.model.TextResult;
import java.util.Objects;

/** The fixed set of analyzers every job runs. */
public record AnalyzerSuite(
    ImageAnalyzer<ColorResult> color,
    ImageAnalyzer<QualityResult> quality,
    ImageAnalyzer<FaceResult> face,
    ImageAnalyzer<TextResult> text,
    ImageAnalyzer<SceneResult> scene) {

  public AnalyzerSuite {
    Objects.requireNonNull(color, "color");
    Objects.requireNonNull(quality, "quality");
    Objects.requireNonNull(face, "face");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(scene, "scene");
  }
}
