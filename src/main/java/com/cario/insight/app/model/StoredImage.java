package com.cario.insight.app.model;

/** Image bytes read back from storage together with the content type to serve them with. */
public record StoredImage(byte[] bytes, String contentType) {}
