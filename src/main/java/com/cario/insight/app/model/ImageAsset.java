package com.cario.insight.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An uploaded image. Immutable once stored, apart from {@code annotatedKey} which points at a
 * derived artifact whose lifetime is independent of the insights.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ImageAsset {

  /** Same value as the job id. */
  private String id;

  /** Sanitized client filename. */
  private String filename;

  private String originalKey;

  /** Null until the annotation renderer has stored a derived image. */
  private String annotatedKey;

  private String contentType;

  /** Format detected from content (png, jpeg, gif, bmp, webp). */
  private String format;

  private long sizeBytes;

  /** SHA-256 hex of the original bytes. */
  private String checksum;

  private Integer width;
  private Integer height;

  private Instant uploadedAt;
}
