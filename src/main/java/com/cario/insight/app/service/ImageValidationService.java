package com.cario.insight.app.service;

import com.cario.insight.app.analyzer.ImageDecoder;
import com.cario.insight.app.analyzer.ImageDecoder.ImageInfo;
import com.cario.insight.app.exception.ValidationException;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FilenameUtils;

/**
 * Synchronous upload checks. Everything here runs before anything is stored, so a rejected upload
 * never creates a job.
 */
@Log4j2
public class ImageValidationService {

  static final int MAX_FILENAME_LENGTH = 255;

  private final long maxSizeBytes;
  private final long maxPixels;
  private final Set<String> allowedExtensions;
  private final ImageDecoder decoder;

  /** Result of a passed check: the cleaned filename and what the content really is. */
  public record ValidatedUpload(String filename, ImageInfo info) {}

  /** Pixel ceiling taken from the decoder. */
  public ImageValidationService(
      long maxSizeBytes, Set<String> allowedExtensions, ImageDecoder decoder) {
    this(maxSizeBytes, decoder.maxPixels(), allowedExtensions, decoder);
  }

  public ImageValidationService(
      long maxSizeBytes, long maxPixels, Set<String> allowedExtensions, ImageDecoder decoder) {
    this.maxSizeBytes = maxSizeBytes;
    this.maxPixels = maxPixels;
    this.allowedExtensions =
        allowedExtensions.stream()
            .map(e -> e.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    this.decoder = decoder;
  }

  public ValidatedUpload validate(byte[] bytes, String originalFilename) {
    if (bytes == null || bytes.length == 0) {
      throw new ValidationException("No image data provided");
    }
    if (bytes.length > maxSizeBytes) {
      log.info("upload.reject reason=too_large size={} max={}", bytes.length, maxSizeBytes);
      throw new ValidationException(
          "File too large: " + bytes.length + " bytes exceeds limit of " + maxSizeBytes);
    }

    String filename = sanitizeFilename(originalFilename);
    String ext = FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT);
    if (!allowedExtensions.contains(ext)) {
      log.info("upload.reject reason=extension filename={}", filename);
      throw new ValidationException(
          "File type not allowed. Allowed types: " + String.join(", ", allowedExtensions));
    }

    ImageInfo info =
        decoder
            .readHeader(bytes)
            .orElseThrow(() -> new ValidationException("File content is not a readable image"));
    if (!allowedExtensions.contains(info.format())) {
      log.info("upload.reject reason=format detected={}", info.format());
      throw new ValidationException("Unsupported image format: " + info.format());
    }
    if (info.pixels() > maxPixels) {
      log.info(
          "upload.reject reason=too_many_pixels size={}x{} max={}",
          info.width(),
          info.height(),
          maxPixels);
      throw new ValidationException(
          "Image dimensions too large: "
              + info.width()
              + "x"
              + info.height()
              + " exceeds limit of "
              + maxPixels
              + " pixels");
    }
    return new ValidatedUpload(filename, info);
  }

  /**
   * Reduces a client filename to a safe basename: directories and {@code ..} are dropped, anything
   * outside {@code [A-Za-z0-9._-]} becomes {@code _}, and the result is capped at 255 characters
   * with the extension kept.
   */
  public static String sanitizeFilename(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ValidationException("No filename provided");
    }
    if (raw.indexOf('\0') >= 0) {
      throw new ValidationException("Invalid filename");
    }
    String base = raw.replace('\\', '/');
    base = base.substring(base.lastIndexOf('/') + 1);
    base = base.replace("..", "");
    base = base.replaceAll("[^A-Za-z0-9._-]", "_");
    base = base.replaceAll("^[._]+", "");
    if (base.isEmpty() || FilenameUtils.getBaseName(base).isEmpty()) {
      throw new ValidationException("Invalid filename");
    }
    if (base.length() > MAX_FILENAME_LENGTH) {
      String ext = FilenameUtils.getExtension(base);
      int keep = MAX_FILENAME_LENGTH - (ext.isEmpty() ? 0 : ext.length() + 1);
      base = FilenameUtils.getBaseName(base).substring(0, keep) + (ext.isEmpty() ? "" : "." + ext);
    }
    return base;
  }
}
