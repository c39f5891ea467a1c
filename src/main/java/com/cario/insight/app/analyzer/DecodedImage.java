package com.cario.insight.app.analyzer;

import com.cario.insight.app.exception.DecodeException;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Read-only RGB raster shared by all analyzers of one job. Every accessor that exposes pixel
 * data returns a fresh array, so no analyzer can change what another one sees.
 */
public final class DecodedImage {

  private final int width;
  private final int height;
  private final int[] rgb;
  private final String format;

  private DecodedImage(int width, int height, int[] rgb, String format) {
    this.width = width;
    this.height = height;
    this.rgb = rgb;
    this.format = format;
  }

  public static DecodedImage of(BufferedImage image, String format) {
    Objects.requireNonNull(image, "image must not be null");
    int w = image.getWidth();
    int h = image.getHeight();
    if (w <= 0 || h <= 0) {
      throw new DecodeException("Image has no pixels (" + w + "x" + h + ")");
    }
    int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
    for (int i = 0; i < argb.length; i++) {
      argb[i] &= 0xFFFFFF;
    }
    return new DecodedImage(w, h, argb, format);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int pixelCount() {
    return rgb.length;
  }

  /** Lower-case format name as detected from the content (png, jpeg, gif, bmp, webp). */
  public String format() {
    return format;
  }

  /** Packed {@code 0xRRGGBB} at (x, y). */
  public int rgb(int x, int y) {
    return rgb[y * width + x];
  }

  /** Row-major copy of all packed {@code 0xRRGGBB} pixels. */
  public int[] rgbPixels() {
    return rgb.clone();
  }

  /** A new {@code TYPE_INT_RGB} copy that callers may draw on. */
  public BufferedImage toBufferedImage() {
    BufferedImage copy = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    copy.setRGB(0, 0, width, height, rgb, 0, width);
    return copy;
  }
}
