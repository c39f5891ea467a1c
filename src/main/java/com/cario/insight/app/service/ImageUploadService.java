package com.cario.insight.app.service;

import com.cario.insight.app.exception.PipelineException;
import com.cario.insight.app.model.FailureReason;
import com.cario.insight.app.model.ImageAsset;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.JobHandle;
import com.cario.insight.app.model.JobStatus;
import com.cario.insight.app.queue.JobQueue;
import com.cario.insight.app.repository.InsightRecordStore;
import com.cario.insight.app.service.ImageValidationService.ValidatedUpload;
import com.cario.insight.app.storage.ImageStorage;
import com.cario.insight.app.storage.StorageKeys;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Accepts an upload: validate, store the original, create the {@code processing} record, enqueue.
 * The original is durable before the job is queued, so a worker can always fetch it.
 */
@Log4j2
public class ImageUploadService {

  private final ImageValidationService validation;
  private final ImageStorage storage;
  private final InsightRecordStore store;
  private final JobQueue queue;
  private final Clock clock;

  public ImageUploadService(
      ImageValidationService validation,
      ImageStorage storage,
      InsightRecordStore store,
      JobQueue queue,
      Clock clock) {
    this.validation = validation;
    this.storage = storage;
    this.store = store;
    this.queue = queue;
    this.clock = clock;
  }

  /**
   * @throws com.cario.insight.app.exception.ValidationException when the upload is rejected; no
   *     job exists afterwards
   * @throws com.cario.insight.app.exception.StorageException when the original cannot be stored
   */
  public JobHandle submit(byte[] bytes, String originalFilename) {
    ValidatedUpload upload = validation.validate(bytes, originalFilename);

    // The stored extension follows the detected content, not the client name.
    String ext = "jpeg".equals(upload.info().format()) ? "jpg" : upload.info().format();
    String key = storage.save(bytes, "upload." + ext);

    Instant now = Instant.now(clock);
    String jobId = UUID.randomUUID().toString();
    ImageAsset asset =
        ImageAsset.builder()
            .id(jobId)
            .filename(upload.filename())
            .originalKey(key)
            .contentType(StorageKeys.contentTypeFor(key))
            .format(upload.info().format())
            .sizeBytes(bytes.length)
            .checksum(DigestUtils.sha256Hex(bytes))
            .width(upload.info().width())
            .height(upload.info().height())
            .uploadedAt(now)
            .build();

    try {
      store.createIfAbsent(InsightRecord.processing(asset, now));
    } catch (RuntimeException e) {
      // no record will ever point at the original
      log.error(
          "upload.recordFailed jobId={} key={} msg={}",
          jobId,
          StorageKeys.logKey(key),
          e.getMessage());
      deleteOriginal(key, e);
      throw e;
    }
    log.info(
        "upload.accepted jobId={} key={} size={} format={} filename={}",
        jobId,
        StorageKeys.logKey(key),
        bytes.length,
        asset.getFormat(),
        asset.getFilename());

    try {
      queue.enqueue(jobId);
    } catch (PipelineException e) {
      store.markFailed(jobId, FailureReason.PIPELINE_ERROR, 0L);
      throw e;
    }
    return new JobHandle(jobId, JobStatus.PROCESSING);
  }

  private void deleteOriginal(String key, RuntimeException cause) {
    try {
      storage.delete(key);
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
      log.warn("upload.cleanupFailed key={} msg={}", StorageKeys.logKey(key), e.getMessage());
    }
  }
}
