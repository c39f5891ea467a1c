package com.cario.insight.app.service;

import com.cario.insight.app.model.ColorResult;
import com.cario.insight.app.model.FaceResult;
import com.cario.insight.app.model.Insights;
import com.cario.insight.app.model.QualityResult;
import com.cario.insight.app.model.SceneResult;
import com.cario.insight.app.model.SceneType;
import com.cario.insight.app.model.TextResult;
import lombok.extern.log4j.Log4j2;

/**
 * Folds the partial results into one {@link Insights} payload. Fields of a failed analyzer stay
 * null; numeric values outside their declared range are clamped to the nearest bound.
 */
@Log4j2
public class InsightAggregator {

  public Insights aggregate(String jobId, AnalysisOutcomes outcomes) {
    Insights.InsightsBuilder b = Insights.builder();

    if (outcomes.color().isOk()) {
      ColorResult c = outcomes.color().value();
      b.dominantColors(c.dominantColors())
          .brightness((int) clamp(jobId, "brightness", c.brightness(), 0, 255));
    }

    if (outcomes.face().isOk()) {
      FaceResult f = outcomes.face().value();
      b.facesDetected(f.count()).faceLocations(f.faces());
    }

    if (outcomes.text().isOk()) {
      TextResult t = outcomes.text().value();
      b.textFound(t.textFound())
          .extractedText(t.extractedText() == null ? "" : t.extractedText())
          .wordCount((int) clamp(jobId, "word_count", t.wordCount(), 0, Integer.MAX_VALUE));
    }

    if (outcomes.quality().isOk()) {
      QualityResult q = outcomes.quality().value();
      b.sharpnessScore(clamp(jobId, "sharpness_score", q.sharpnessScore(), 0, Double.MAX_VALUE))
          .blurLevel(q.blurLevel())
          .contrastScore(clamp(jobId, "contrast_score", q.contrastScore(), 0, Double.MAX_VALUE))
          .qualityScore(clamp(jobId, "quality_score", q.qualityScore(), 0, 100));
    }

    if (outcomes.scene().isOk()) {
      SceneResult s = outcomes.scene().value();
      b.sceneType(s.sceneType() == null ? SceneType.UNKNOWN : s.sceneType())
          .sceneConfidence(clamp(jobId, "scene_confidence", s.confidence(), 0, 1));
    }

    return b.build();
  }

  static double clamp(String jobId, String field, double value, double min, double max) {
    if (Double.isNaN(value)) {
      log.warn("aggregate.clamp jobId={} field={} value=NaN -> {}", jobId, field, min);
      return min;
    }
    if (value < min || value > max) {
      double clamped = Math.max(min, Math.min(max, value));
      log.warn("aggregate.clamp jobId={} field={} value={} -> {}", jobId, field, value, clamped);
      return clamped;
    }
    return value;
  }
}
