package com.cario.insight.app.config;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed view of the {@code insight.*} settings. Bound once at startup and handed to the services
 * that need it through their constructors.
 */
@Data
@ConfigurationProperties(prefix = "insight")
public class InsightProperties {

  private Upload upload = new Upload();
  private Pipeline pipeline = new Pipeline();
  private Color color = new Color();
  private Storage storage = new Storage();
  private ResultStore resultStore = new ResultStore();
  private Face face = new Face();
  private Ocr ocr = new Ocr();
  private Sweeper sweeper = new Sweeper();

  @Data
  public static class Upload {
    /** Uploads above this size are rejected before decode. */
    private long maxSizeBytes = 16L * 1024 * 1024;

    /** Width times height ceiling, checked from the header at upload and again before decode. */
    private long maxPixels = 89_478_485L;

    private Set<String> allowedExtensions =
        new LinkedHashSet<>(Set.of("png", "jpg", "jpeg", "gif", "bmp", "webp"));
  }

  @Data
  public static class Pipeline {
    /** Wall-clock budget of one job, from fetch to final write. */
    private Duration jobTimeout = Duration.ofSeconds(60);

    /** Store an unmodified annotated copy even when no face was detected. */
    private boolean renderEmptyAnnotations = false;

    private int workerThreads = 4;
    private int analyzerThreads = 5;
    private int queueCapacity = 100;
  }

  @Data
  public static class Color {
    /** Number of dominant colors (K). */
    private int clusters = 5;

    private int maxIterations = 20;

    /** Pixels beyond this count are sampled on a regular grid before clustering. */
    private int sampleLimit = 40_000;
  }

  @Data
  public static class Storage {
    /** {@code local} or {@code s3}. */
    private String type = "local";

    private String localRoot = "uploads";

    /** Optional base URL under which the local root is served. */
    private String publicBaseUrl;

    private S3 s3 = new S3();
    private Retry retry = new Retry();
  }

  @Data
  public static class S3 {
    private String bucket = "peek";
    private String prefix = "images/";

    /** Custom public domain for stable links; without it only presigned access is possible. */
    private String publicDomain;

    private Duration presignTtl = Duration.ofHours(24);
  }

  @Data
  public static class Retry {
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
  }

  @Data
  public static class ResultStore {
    /** {@code memory} or {@code dynamodb}. */
    private String type = "memory";

    private String table = "InsightRecord";
  }

  @Data
  public static class Face {
    /** {@code opencv} (Haar cascade) or {@code skin} (skin-tone region heuristic). */
    private String locator = "opencv";

    /** Haar cascade XML, a file path or a {@code classpath:} resource. */
    private String cascadePath = "classpath:cascades/haarcascade_frontalface_default.xml";
  }

  @Data
  public static class Ocr {
    /** Tesseract tessdata directory; Tesseract's own default when unset. */
    private String dataPath;

    private String language = "eng";
  }

  @Data
  public static class Sweeper {
    private boolean enabled = true;
    private String cron = "0 * * * * *";

    /** Extra time past the job timeout before a processing record counts as abandoned. */
    private Duration grace = Duration.ofSeconds(30);
  }
}
