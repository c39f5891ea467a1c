package com.cario.insight.app.service;

import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.AnalyzerOutcome;
import com.cario.insight.app.model.ColorResult;
import com.cario.insight.app.model.FaceBox;
import com.cario.insight.app.model.FaceResult;
import com.cario.insight.app.model.QualityResult;
import com.cario.insight.app.model.SceneResult;
import com.cario.insight.app.model.TextResult;
import java.util.ArrayList;
import java.util.List;

/** Partial results of one job, one slot per analyzer. */
public record AnalysisOutcomes(
    AnalyzerOutcome<ColorResult> color,
    AnalyzerOutcome<QualityResult> quality,
    AnalyzerOutcome<FaceResult> face,
    AnalyzerOutcome<TextResult> text,
    AnalyzerOutcome<SceneResult> scene) {

  public List<AnalyzerOutcome<?>> all() {
    return List.of(color, quality, face, text, scene);
  }

  /** Failed analyzers in declaration order. */
  public List<AnalyzerKind> failedKinds() {
    List<AnalyzerKind> failed = new ArrayList<>();
    for (AnalyzerOutcome<?> o : all()) {
      if (!o.isOk()) {
        failed.add(o.kind());
      }
    }
    return failed;
  }

  public boolean allFailed() {
    return failedKinds().size() == all().size();
  }

  /** Boxes to annotate; empty when face detection failed or found nothing. */
  public List<FaceBox> faceBoxes() {
    return face.isOk() ? face.value().faces() : List.of();
  }
}
