package com.cario.insight.app.analyzer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.log4j.Log4j2;
import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * OpenCV plumbing shared by the analyzers: native runtime loading, {@link DecodedImage} to
 * {@link Mat} conversion, and release of native buffers.
 *
 * <p>Mats returned here are owned by the caller and must be passed to {@link #release(Mat...)}.
 */
@Log4j2
public final class OpenCvMats {

  public static final String CLASSPATH_PREFIX = "classpath:";

  private static volatile boolean loaded;

  private OpenCvMats() {}

  /** Loads the bundled native library once per JVM. */
  public static void ensureLoaded() {
    if (loaded) {
      return;
    }
    synchronized (OpenCvMats.class) {
      if (!loaded) {
        OpenCV.loadLocally();
        loaded = true;
        log.info("opencv.loaded version={}", Core.VERSION);
      }
    }
  }

  /** 8-bit, 3 channel Mat in R, G, B channel order. */
  public static Mat rgb(DecodedImage image) {
    ensureLoaded();
    int[] pixels = image.rgbPixels();
    byte[] data = new byte[pixels.length * 3];
    for (int i = 0, j = 0; i < pixels.length; i++, j += 3) {
      int p = pixels[i];
      data[j] = (byte) (p >> 16);
      data[j + 1] = (byte) (p >> 8);
      data[j + 2] = (byte) p;
    }
    Mat mat = new Mat(image.height(), image.width(), CvType.CV_8UC3);
    mat.put(0, 0, data);
    return mat;
  }

  /** 8-bit single channel BT.601 luma. */
  public static Mat gray(DecodedImage image) {
    return convert(image, Imgproc.COLOR_RGB2GRAY);
  }

  /** 8-bit HSV: hue on 0..180, saturation and value on 0..255. */
  public static Mat hsv(DecodedImage image) {
    return convert(image, Imgproc.COLOR_RGB2HSV);
  }

  private static Mat convert(DecodedImage image, int code) {
    Mat rgb = rgb(image);
    try {
      Mat out = new Mat();
      Imgproc.cvtColor(rgb, out, code);
      return out;
    } finally {
      rgb.release();
    }
  }

  /** Null-tolerant release of native buffers. */
  public static void release(Mat... mats) {
    if (mats == null) {
      return;
    }
    for (Mat m : mats) {
      if (m != null) {
        m.release();
      }
    }
  }

  /**
   * Resolves a model file for OpenCV's file-only loaders. {@code classpath:} locations are copied
   * once into a temp file, since the native side cannot read from inside a jar.
   *
   * @throws IllegalStateException when the location cannot be read
   */
  public static Path materialize(String location) {
    if (location == null || location.isBlank()) {
      throw new IllegalArgumentException("location must not be blank");
    }
    if (!location.startsWith(CLASSPATH_PREFIX)) {
      Path path = Path.of(location);
      if (!Files.isReadable(path)) {
        throw new IllegalStateException("Model file not readable: " + location);
      }
      return path;
    }

    String resource = location.substring(CLASSPATH_PREFIX.length());
    if (resource.startsWith("/")) {
      resource = resource.substring(1);
    }
    try (InputStream in = OpenCvMats.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Model resource not on classpath: " + resource);
      }
      String name = Path.of(resource).getFileName().toString();
      Path copy = Files.createTempFile("insight-", "-" + name);
      copy.toFile().deleteOnExit();
      Files.copy(in, copy, StandardCopyOption.REPLACE_EXISTING);
      log.info("opencv.model.copied resource={} path={}", resource, copy);
      return copy;
    } catch (IOException e) {
      throw new IllegalStateException("Failed to copy model resource " + resource, e);
    }
  }
}
