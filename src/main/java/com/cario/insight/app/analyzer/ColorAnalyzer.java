package com.cario.insight.app.analyzer;

import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.ColorResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.TermCriteria;

/**
 * Dominant colors by OpenCV k-means over RGB plus mean brightness.
 *
 * <p>Deterministic: the OpenCV RNG of the calling thread is reseeded before every fit and seeding
 * uses k-means++. Clusters are ranked by population over every pixel, ties by the scan position of
 * their first pixel. When the image has fewer distinct colors than K the least populous centroid is
 * repeated, so a uniform image yields K identical colors.
 */
@Log4j2
public class ColorAnalyzer implements ImageAnalyzer<ColorResult> {

  private static final int SEED = 42;
  private static final int ATTEMPTS = 3;
  private static final double EPSILON = 0.5;

  private final int clusters;
  private final int maxIterations;
  private final int sampleLimit;

  public ColorAnalyzer(int clusters, int maxIterations, int sampleLimit) {
    if (clusters < 1) {
      throw new IllegalArgumentException("clusters must be >= 1");
    }
    this.clusters = clusters;
    this.maxIterations = Math.max(1, maxIterations);
    this.sampleLimit = Math.max(clusters, sampleLimit);
  }

  @Override
  public AnalyzerKind kind() {
    return AnalyzerKind.COLOR;
  }

  @Override
  public ColorResult analyze(DecodedImage image) {
    int[] pixels = image.rgbPixels();
    float[][] centroids = fit(pixels);

    long[] population = new long[centroids.length];
    int[] firstSeen = new int[centroids.length];
    Arrays.fill(firstSeen, Integer.MAX_VALUE);
    for (int i = 0; i < pixels.length; i++) {
      int c = nearest(centroids, pixels[i]);
      population[c]++;
      if (firstSeen[c] == Integer.MAX_VALUE) {
        firstSeen[c] = i;
      }
    }

    List<Integer> order = new ArrayList<>(centroids.length);
    for (int c = 0; c < centroids.length; c++) {
      order.add(c);
    }
    order.sort(
        Comparator.<Integer>comparingLong(c -> population[c])
            .reversed()
            .thenComparingInt(c -> firstSeen[c])
            .thenComparingInt(c -> c));

    List<String> hex = new ArrayList<>(clusters);
    for (int c : order) {
      hex.add(toHex(centroids[c]));
    }
    while (hex.size() < clusters) {
      hex.add(hex.get(hex.size() - 1));
    }

    int brightness = brightness(image);
    log.debug("color.analyze k={} colors={} brightness={}", clusters, hex, brightness);
    return new ColorResult(hex, brightness);
  }

  /** Runs {@link Core#kmeans} on a strided sample; returns at most K centroids as RGB floats. */
  private float[][] fit(int[] pixels) {
    int step = Math.max(1, (int) Math.ceil((double) pixels.length / sampleLimit));
    int n = (pixels.length + step - 1) / step;
    float[] data = new float[n * 3];
    Set<Integer> distinct = new HashSet<>();
    for (int i = 0, j = 0; j < n; i += step, j++) {
      int p = pixels[i];
      data[j * 3] = (p >> 16) & 0xFF;
      data[j * 3 + 1] = (p >> 8) & 0xFF;
      data[j * 3 + 2] = p & 0xFF;
      if (distinct.size() < clusters) {
        distinct.add(p);
      }
    }
    // k-means cannot place more centers than there are distinct points
    int k = Math.min(clusters, distinct.size());

    OpenCvMats.ensureLoaded();
    Mat samples = new Mat(n, 3, CvType.CV_32F);
    Mat labels = new Mat();
    Mat centers = new Mat();
    try {
      samples.put(0, 0, data);
      Core.setRNGSeed(SEED);
      Core.kmeans(
          samples,
          k,
          labels,
          new TermCriteria(TermCriteria.COUNT + TermCriteria.EPS, maxIterations, EPSILON),
          ATTEMPTS,
          Core.KMEANS_PP_CENTERS,
          centers);

      float[][] out = new float[centers.rows()][3];
      for (int c = 0; c < out.length; c++) {
        centers.get(c, 0, out[c]);
      }
      return out;
    } finally {
      OpenCvMats.release(samples, labels, centers);
    }
  }

  /** Mean BT.601 luma of the grayscale conversion, 0..255. */
  private static int brightness(DecodedImage image) {
    Mat gray = OpenCvMats.gray(image);
    try {
      double mean = Core.mean(gray).val[0];
      return (int) Math.max(0, Math.min(255, Math.round(mean)));
    } finally {
      gray.release();
    }
  }

  /** Ties resolve to the lowest cluster index. */
  private static int nearest(float[][] centroids, int p) {
    int r = (p >> 16) & 0xFF;
    int g = (p >> 8) & 0xFF;
    int b = p & 0xFF;
    int best = 0;
    double bestDist = Double.MAX_VALUE;
    for (int c = 0; c < centroids.length; c++) {
      double dr = centroids[c][0] - r;
      double dg = centroids[c][1] - g;
      double db = centroids[c][2] - b;
      double d = dr * dr + dg * dg + db * db;
      if (d < bestDist) {
        bestDist = d;
        best = c;
      }
    }
    return best;
  }

  private static String toHex(float[] c) {
    return String.format("#%02x%02x%02x", channel(c[0]), channel(c[1]), channel(c[2]));
  }

  private static int channel(double v) {
    return (int) Math.max(0, Math.min(255, Math.round(v)));
  }
}
