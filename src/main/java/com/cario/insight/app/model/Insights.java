package com.cario.insight.app.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate of the five partial results. Fields belonging to an analyzer that failed are left
 * {@code null}; the record lists the failed analyzers separately.
 *
 * <p>Field names and order are part of the client contract, clients poll and parse this object.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
  "dominant_colors",
  "brightness",
  "faces_detected",
  "face_locations",
  "text_found",
  "extracted_text",
  "word_count",
  "sharpness_score",
  "blur_level",
  "contrast_score",
  "quality_score",
  "scene_type",
  "scene_confidence"
})
public class Insights {

  // color
  private List<String> dominantColors;
  private Integer brightness;

  // faces
  private Integer facesDetected;
  private List<FaceBox> faceLocations;

  // text
  private Boolean textFound;
  private String extractedText;
  private Integer wordCount;

  // quality
  private Double sharpnessScore;
  private BlurLevel blurLevel;
  private Double contrastScore;
  private Double qualityScore;

  // scene
  private SceneType sceneType;
  private Double sceneConfidence;
}
