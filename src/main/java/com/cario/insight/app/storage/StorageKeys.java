package com.cario.insight.app.storage;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.apache.commons.io.FilenameUtils;

/** Key and content-type helpers shared by the storage backends. */
public final class StorageKeys {

  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private static final Map<String, String> CONTENT_TYPES =
      Map.of(
          "png", "image/png",
          "jpg", "image/jpeg",
          "jpeg", "image/jpeg",
          "gif", "image/gif",
          "bmp", "image/bmp",
          "webp", "image/webp");

  private StorageKeys() {}

  /** {@code <prefix><yyyyMMdd_HHmmss>_<8 hex>.<ext>}; the random token keeps keys unique. */
  public static String generate(String prefix, String suggestedName) {
    String ext = extension(suggestedName);
    String token = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    String base = LocalDateTime.now().format(STAMP) + "_" + token;
    return normalizePrefix(prefix) + base + (ext.isEmpty() ? "" : "." + ext);
  }

  /** {@code images/a.png} becomes {@code images/a_annotated.png}. */
  public static String annotatedKey(String originalKey, String ext) {
    String base = FilenameUtils.removeExtension(originalKey);
    String e = (ext == null || ext.isBlank()) ? extension(originalKey) : ext;
    return base + "_annotated" + (e.isEmpty() ? "" : "." + e);
  }

  public static String extension(String name) {
    if (name == null) return "";
    String ext = FilenameUtils.getExtension(name);
    return ext == null ? "" : ext.toLowerCase(Locale.ROOT);
  }

  public static String contentTypeFor(String key) {
    return CONTENT_TYPES.getOrDefault(extension(key), "application/octet-stream");
  }

  public static String normalizePrefix(String p) {
    if (p == null || p.isBlank()) return "";
    return p.endsWith("/") ? p : p + "/";
  }

  public static String logKey(String key) {
    if (key == null) return null;
    return key.length() > 120 ? key.substring(0, 120) + "...(truncated)" : key;
  }
}
