package com.cario.insight.app.storage;

import com.cario.insight.app.exception.StorageException;
import com.cario.insight.app.exception.StorageNotFoundException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * Object-store backend over any S3-compatible API (AWS S3, Cloudflare R2, LocalStack).
 *
 * <p>Stable public links exist only when a public domain is configured; otherwise callers use
 * {@link #signedUrl(String, Duration)} or fetch the bytes.
 */
@Log4j2
public class S3ImageStorage implements ImageStorage {

  private static final String CACHE_CONTROL = "public, max-age=31536000";

  private final S3Client s3;
  private final S3Presigner presigner;
  private final String bucket;
  private final String prefix;
  private final String publicDomain;

  public S3ImageStorage(
      S3Client s3, S3Presigner presigner, String bucket, String prefix, String publicDomain) {
    this.s3 = Objects.requireNonNull(s3, "S3Client must not be null");
    this.presigner = presigner;
    this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
    this.prefix = StorageKeys.normalizePrefix(prefix);
    this.publicDomain = publicDomain;
  }

  @Override
  public String save(byte[] bytes, String suggestedName) {
    String key = StorageKeys.generate(prefix, suggestedName);
    put(key, bytes, StorageKeys.contentTypeFor(key));
    return key;
  }

  @Override
  public void saveAs(String key, byte[] bytes, String contentType) {
    put(key, bytes, contentType == null ? StorageKeys.contentTypeFor(key) : contentType);
  }

  @Override
  public byte[] fetch(String key) {
    try {
      return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build())
          .asByteArray();
    } catch (NoSuchKeyException e) {
      throw new StorageNotFoundException(key);
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        throw new StorageNotFoundException(key);
      }
      throw new StorageException("Failed to download s3://" + bucket + "/" + key, e);
    } catch (SdkException e) {
      throw new StorageException("Failed to download s3://" + bucket + "/" + key, e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      s3.deleteObject(b -> b.bucket(bucket).key(key));
      log.info("s3.delete ok bucket={} key={}", bucket, StorageKeys.logKey(key));
    } catch (SdkException e) {
      throw new StorageException("Failed to delete s3://" + bucket + "/" + key, e);
    }
  }

  @Override
  public Optional<String> publicUrl(String key) {
    if (publicDomain == null || publicDomain.isBlank()) {
      return Optional.empty();
    }
    String domain =
        publicDomain.endsWith("/")
            ? publicDomain.substring(0, publicDomain.length() - 1)
            : publicDomain;
    return Optional.of(domain + "/" + encodeKey(key));
  }

  /** Empty when no presigner is configured. */
  @Override
  public Optional<String> signedUrl(String key, Duration ttl) {
    if (presigner == null) {
      return Optional.empty();
    }
    GetObjectPresignRequest presign =
        GetObjectPresignRequest.builder()
            .signatureDuration(ttl)
            .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
            .build();
    return Optional.of(presigner.presignGetObject(presign).url().toString());
  }

  @Override
  public boolean isAvailable() {
    try {
      s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
      return true;
    } catch (SdkException e) {
      log.warn("s3.health bucket={} msg={}", bucket, e.getMessage());
      return false;
    }
  }

  // ------------------ Helpers ------------------

  private void put(String key, byte[] bytes, String contentType) {
    try {
      PutObjectRequest req =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength((long) bytes.length)
              .cacheControl(CACHE_CONTROL)
              .build();

      PutObjectResponse resp = s3.putObject(req, RequestBody.fromBytes(bytes));
      log.info(
          "s3.upload ok bucket={} key={} size={} eTag={}",
          bucket,
          StorageKeys.logKey(key),
          bytes.length,
          resp.eTag());
    } catch (SdkException e) {
      log.error("s3.upload error bucket={} key={} msg={}", bucket, key, e.getMessage(), e);
      throw new StorageException("Failed to upload to s3://" + bucket + "/" + key, e);
    }
  }

  /** Encode each segment; do NOT encode '/' */
  private static String encodeKey(String key) {
    return Arrays.stream(key.split("/"))
        .map(s -> URLEncoder.encode(s, StandardCharsets.UTF_8))
        .map(s -> s.replace("+", "%20"))
        .collect(Collectors.joining("/"));
  }
}
