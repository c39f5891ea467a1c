package com.cario.insight.app.model;

public record QualityResult(
    double sharpnessScore, BlurLevel blurLevel, double contrastScore, double qualityScore) {}
