package com.cario.insight.app.service;

import com.cario.insight.app.analyzer.DecodedImage;
import com.cario.insight.app.model.FaceBox;
import com.cario.insight.app.model.ImageAsset;
import com.cario.insight.app.storage.ImageStorage;
import com.cario.insight.app.storage.StorageKeys;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.extern.log4j.Log4j2;

/**
 * Draws face boxes onto a copy of the original and stores it as a derived artifact next to the
 * original key. The output keeps the input format, except WEBP which has no ImageIO writer and is
 * stored as PNG.
 */
@Log4j2
public class AnnotationService {

  static final Color BOX_COLOR = new Color(0, 255, 0);
  static final int BOX_THICKNESS = 2;

  private final ImageStorage storage;

  public AnnotationService(ImageStorage storage) {
    this.storage = storage;
  }

  /**
   * @return key of the stored annotated image
   * @throws IllegalStateException if the image cannot be encoded
   */
  public String render(ImageAsset asset, DecodedImage image, List<FaceBox> faces) {
    String format = outputFormat(image.format());
    byte[] encoded = encode(draw(image, faces), format);
    String key = keyFor(asset, image);
    storage.saveAs(key, encoded, StorageKeys.contentTypeFor(key));
    log.info(
        "annotate.save ok jobId={} key={} faces={} size={}",
        asset.getId(),
        StorageKeys.logKey(key),
        faces.size(),
        encoded.length);
    return key;
  }

  /** Key {@link #render} stores under; known before rendering so a partial write can be removed. */
  public String keyFor(ImageAsset asset, DecodedImage image) {
    return StorageKeys.annotatedKey(
        asset.getOriginalKey(), extensionFor(outputFormat(image.format())));
  }

  /** Returns a new image; the decoded source is never touched. */
  static BufferedImage draw(DecodedImage image, List<FaceBox> faces) {
    BufferedImage copy = image.toBufferedImage();
    Graphics2D g = copy.createGraphics();
    try {
      g.setColor(BOX_COLOR);
      g.setStroke(new BasicStroke(BOX_THICKNESS));
      for (FaceBox f : faces) {
        g.drawRect(f.x(), f.y(), f.width(), f.height());
      }
    } finally {
      g.dispose();
    }
    return copy;
  }

  static String outputFormat(String inputFormat) {
    if (inputFormat == null) return "png";
    switch (inputFormat) {
      case "jpeg":
      case "png":
      case "gif":
      case "bmp":
        return inputFormat;
      default:
        return "png";
    }
  }

  private static String extensionFor(String format) {
    return "jpeg".equals(format) ? "jpg" : format;
  }

  private static byte[] encode(BufferedImage image, String format) {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      if (!ImageIO.write(image, format, out)) {
        throw new IllegalStateException("No ImageIO writer for format " + format);
      }
      return out.toByteArray();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to encode annotated image: " + e.getMessage(), e);
    }
  }
}
