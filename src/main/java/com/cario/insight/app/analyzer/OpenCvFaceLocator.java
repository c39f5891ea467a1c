package com.cario.insight.app.analyzer;

import com.cario.insight.app.model.FaceBox;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opencv.core.Mat;
import org.opencv.core.MatOfRect;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.objdetect.CascadeClassifier;

/**
 * Haar cascade detection through OpenCV. A classifier instance is not safe for concurrent use, so
 * each worker thread loads its own.
 *
 * <p>The cascade may be a file path or a {@code classpath:} resource. A cascade that cannot be
 * read does not stop the service: every {@link #locate} call then fails, which the pipeline records
 * as a failed face analyzer.
 */
@Log4j2
public class OpenCvFaceLocator implements FaceLocator {

  public static final String DEFAULT_CASCADE =
      "classpath:cascades/haarcascade_frontalface_default.xml";

  static final double SCALE_FACTOR = 1.1;
  static final int MIN_NEIGHBORS = 5;
  static final int MIN_SIZE = 30;

  private final String cascade;
  private final Path cascadeFile;
  private final String unavailableReason;
  private final ThreadLocal<CascadeClassifier> classifiers;

  public OpenCvFaceLocator(String cascade) {
    if (cascade == null || cascade.isBlank()) {
      throw new IllegalArgumentException("cascade must not be blank");
    }
    OpenCvMats.ensureLoaded();
    this.cascade = cascade;
    Path file = null;
    String reason = null;
    try {
      file = OpenCvMats.materialize(cascade);
      log.info("face.opencv cascade={} file={}", cascade, file);
    } catch (IllegalStateException e) {
      reason = e.getMessage();
      log.warn("face.opencv.unavailable cascade={} reason={}", cascade, reason);
    }
    this.cascadeFile = file;
    this.unavailableReason = reason;
    this.classifiers = ThreadLocal.withInitial(this::loadClassifier);
  }

  public boolean isAvailable() {
    return cascadeFile != null;
  }

  @Override
  public List<FaceBox> locate(DecodedImage image) {
    if (cascadeFile == null) {
      throw new IllegalStateException("Face cascade unavailable: " + unavailableReason);
    }
    CascadeClassifier classifier = classifiers.get();
    Mat gray = OpenCvMats.gray(image);
    MatOfRect found = new MatOfRect();
    try {
      classifier.detectMultiScale(
          gray, found, SCALE_FACTOR, MIN_NEIGHBORS, 0, new Size(MIN_SIZE, MIN_SIZE), new Size());
      List<FaceBox> boxes = new ArrayList<>();
      for (Rect r : found.toArray()) {
        boxes.add(new FaceBox(r.x, r.y, r.width, r.height));
      }
      return boxes;
    } finally {
      OpenCvMats.release(gray, found);
    }
  }

  @Override
  public String name() {
    return "opencv-haar";
  }

  private CascadeClassifier loadClassifier() {
    CascadeClassifier classifier = new CascadeClassifier(cascadeFile.toString());
    if (classifier.empty()) {
      throw new IllegalStateException("Failed to load cascade " + cascade);
    }
    return classifier;
  }
}
