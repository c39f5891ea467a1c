package com.cario.insight.app.model;

/** Axis-aligned face bounding box in original-image pixel coordinates. */
public record FaceBox(int x, int y, int width, int height) {}
