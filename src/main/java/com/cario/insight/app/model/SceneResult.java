package com.cario.insight.app.model;

public record SceneResult(SceneType sceneType, double confidence) {}
