package com.cario.insight.app.analyzer;

import com.cario.insight.app.model.FaceBox;
import java.util.ArrayList;
import java.util.List;

/**
 * Opt-in heuristic selected with {@code insight.face.locator=skin}: connected regions of skin-tone
 * pixels (YCbCr rule) whose bounding box is face-sized and roughly face-shaped.
 *
 * <p>Regions are discovered in row-major scan order; a box overlapping an earlier accepted box is
 * dropped, so the result never contains overlapping boxes.
 */
public class SkinRegionFaceLocator implements FaceLocator {

  static final int MIN_SIZE = 30;
  static final double MIN_ASPECT = 0.6;
  static final double MAX_ASPECT = 1.6;
  static final double MIN_FILL = 0.5;

  @Override
  public List<FaceBox> locate(DecodedImage image) {
    int w = image.width();
    int h = image.height();
    boolean[] skin = new boolean[w * h];
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        skin[y * w + x] = isSkin(image.rgb(x, y));
      }
    }

    boolean[] visited = new boolean[w * h];
    int[] queue = new int[w * h];
    List<FaceBox> faces = new ArrayList<>();

    for (int start = 0; start < skin.length; start++) {
      if (!skin[start] || visited[start]) {
        continue;
      }
      int head = 0;
      int tail = 0;
      queue[tail++] = start;
      visited[start] = true;
      int minX = w, minY = h, maxX = -1, maxY = -1, area = 0;

      while (head < tail) {
        int idx = queue[head++];
        int x = idx % w;
        int y = idx / w;
        area++;
        minX = Math.min(minX, x);
        maxX = Math.max(maxX, x);
        minY = Math.min(minY, y);
        maxY = Math.max(maxY, y);
        if (x > 0) tail = visit(idx - 1, skin, visited, queue, tail);
        if (x < w - 1) tail = visit(idx + 1, skin, visited, queue, tail);
        if (y > 0) tail = visit(idx - w, skin, visited, queue, tail);
        if (y < h - 1) tail = visit(idx + w, skin, visited, queue, tail);
      }

      FaceBox box = new FaceBox(minX, minY, maxX - minX + 1, maxY - minY + 1);
      if (looksLikeFace(box, area) && faces.stream().noneMatch(f -> overlaps(f, box))) {
        faces.add(box);
      }
    }
    return faces;
  }

  @Override
  public String name() {
    return "skin-region";
  }

  static boolean isSkin(int rgb) {
    int r = (rgb >> 16) & 0xFF;
    int g = (rgb >> 8) & 0xFF;
    int b = rgb & 0xFF;
    double cb = 128 - 0.168736 * r - 0.331264 * g + 0.5 * b;
    double cr = 128 + 0.5 * r - 0.418688 * g - 0.081312 * b;
    return cb >= 77 && cb <= 127 && cr >= 133 && cr <= 173;
  }

  private static int visit(int idx, boolean[] skin, boolean[] visited, int[] queue, int tail) {
    if (skin[idx] && !visited[idx]) {
      visited[idx] = true;
      queue[tail++] = idx;
    }
    return tail;
  }

  private static boolean looksLikeFace(FaceBox box, int area) {
    if (box.width() < MIN_SIZE || box.height() < MIN_SIZE) {
      return false;
    }
    double aspect = (double) box.width() / box.height();
    double fill = (double) area / ((long) box.width() * box.height());
    return aspect >= MIN_ASPECT && aspect <= MAX_ASPECT && fill >= MIN_FILL;
  }

  private static boolean overlaps(FaceBox a, FaceBox b) {
    return a.x() < b.x() + b.width()
        && b.x() < a.x() + a.width()
        && a.y() < b.y() + b.height()
        && b.y() < a.y() + a.height();
  }
}
