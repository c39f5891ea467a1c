package com.cario.insight.app.model;

import java.util.List;

/** Detected faces in detector scan order. */
public record FaceResult(List<FaceBox> faces) {

  public FaceResult {
    faces = List.copyOf(faces);
  }

  public int count() {
    return faces.size();
  }

  public static FaceResult none() {
    return new FaceResult(List.of());
  }
}
