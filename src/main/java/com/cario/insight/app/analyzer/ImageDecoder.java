package com.cario.insight.app.analyzer;

import com.cario.insight.app.exception.DecodeException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Decodes image bytes through ImageIO; the format is taken from the content, never the name.
 *
 * <p>Dimensions are checked against a pixel ceiling before the raster is allocated, so a small
 * compressed file declaring a huge canvas is rejected instead of exhausting the heap.
 */
public class ImageDecoder {

  /** Same ceiling as Pillow's decompression-bomb guard. */
  public static final long DEFAULT_MAX_PIXELS = 89_478_485L;

  /** Format and dimensions read from the header without decoding the raster. */
  public record ImageInfo(String format, int width, int height) {

    public long pixels() {
      return (long) width * height;
    }
  }

  private final long maxPixels;

  public ImageDecoder() {
    this(DEFAULT_MAX_PIXELS);
  }

  public ImageDecoder(long maxPixels) {
    if (maxPixels < 1) {
      throw new IllegalArgumentException("maxPixels must be >= 1");
    }
    this.maxPixels = maxPixels;
  }

  public long maxPixels() {
    return maxPixels;
  }

  public DecodedImage decode(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new DecodeException("Empty image payload");
    }
    try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
      ImageReader reader = firstReader(in);
      try {
        reader.setInput(in, true, true);
        long pixels = (long) reader.getWidth(0) * reader.getHeight(0);
        if (pixels > maxPixels) {
          throw new DecodeException(
              "Image of "
                  + reader.getWidth(0)
                  + "x"
                  + reader.getHeight(0)
                  + " exceeds the limit of "
                  + maxPixels
                  + " pixels");
        }
        BufferedImage image = reader.read(0);
        if (image == null) {
          throw new DecodeException("Image reader returned no raster");
        }
        return DecodedImage.of(image, normalizeFormat(reader.getFormatName()));
      } finally {
        reader.dispose();
      }
    } catch (DecodeException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new DecodeException("Failed to decode image: " + e.getMessage(), e);
    }
  }

  /** Header sniff used at upload time; empty when the bytes are not a readable image. */
  public Optional<ImageInfo> readHeader(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      return Optional.empty();
    }
    try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
      ImageReader reader = firstReader(in);
      try {
        reader.setInput(in, true, true);
        return Optional.of(
            new ImageInfo(
                normalizeFormat(reader.getFormatName()), reader.getWidth(0), reader.getHeight(0)));
      } finally {
        reader.dispose();
      }
    } catch (IOException | RuntimeException e) {
      return Optional.empty();
    }
  }

  private static ImageReader firstReader(ImageInputStream in) {
    if (in == null) {
      throw new DecodeException("Unreadable image stream");
    }
    Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
    if (!readers.hasNext()) {
      throw new DecodeException("Unsupported or corrupt image data");
    }
    return readers.next();
  }

  static String normalizeFormat(String formatName) {
    String f = formatName == null ? "" : formatName.toLowerCase(Locale.ROOT);
    return switch (f) {
      case "jpg", "jpeg", "jpeg-lossless" -> "jpeg";
      case "wbmp" -> "bmp";
      default -> f;
    };
  }
}
