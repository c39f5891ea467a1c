package com.cario.insight.app.service;

import com.cario.insight.app.exception.JobNotFoundException;
import com.cario.insight.app.exception.StorageNotFoundException;
import com.cario.insight.app.model.ImageAsset;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.StoredImage;
import com.cario.insight.app.repository.InsightRecordStore;
import com.cario.insight.app.storage.ImageStorage;
import com.cario.insight.app.storage.StorageKeys;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/** Read side used by the API: results, originals and annotated images. */
@Log4j2
public class InsightQueryService {

  private final InsightRecordStore store;
  private final ImageStorage storage;
  private final Duration signedUrlTtl;

  public InsightQueryService(
      InsightRecordStore store, ImageStorage storage, Duration signedUrlTtl) {
    this.store = store;
    this.storage = storage;
    this.signedUrlTtl = signedUrlTtl;
  }

  /** @throws JobNotFoundException for an unknown id */
  public InsightRecord getResult(String jobId) {
    return store.find(jobId).orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
  }

  public StoredImage getOriginal(String jobId) {
    ImageAsset asset = getResult(jobId).getAsset();
    return load(jobId, asset.getOriginalKey(), "Original image not found");
  }

  /**
   * @throws JobNotFoundException when the job is unknown, or no annotated image was rendered
   *     (still processing, zero faces with rendering skipped, or the renderer failed)
   */
  public StoredImage getAnnotated(String jobId) {
    ImageAsset asset = getResult(jobId).getAsset();
    if (asset.getAnnotatedKey() == null) {
      throw new JobNotFoundException("Annotated image not found: " + jobId);
    }
    return load(jobId, asset.getAnnotatedKey(), "Annotated image not found");
  }

  /**
   * Link to the original or annotated image: the stable public URL when the backend has one, else
   * a signed URL, else empty (callers fetch the bytes).
   */
  public Optional<String> imageUrl(String jobId, boolean annotated) {
    ImageAsset asset = getResult(jobId).getAsset();
    String key = annotated ? asset.getAnnotatedKey() : asset.getOriginalKey();
    if (key == null) {
      return Optional.empty();
    }
    return storage.publicUrl(key).or(() -> storage.signedUrl(key, signedUrlTtl));
  }

  private StoredImage load(String jobId, String key, String notFoundMessage) {
    try {
      byte[] bytes = storage.fetch(key);
      return new StoredImage(bytes, StorageKeys.contentTypeFor(key));
    } catch (StorageNotFoundException e) {
      log.warn("query.missing jobId={} key={}", jobId, StorageKeys.logKey(key));
      throw new JobNotFoundException(notFoundMessage + ": " + jobId);
    }
  }
}
