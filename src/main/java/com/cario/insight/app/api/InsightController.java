package com.cario.insight.app.api;

import com.cario.insight.app.exception.JobNotFoundException;
import com.cario.insight.app.exception.ValidationException;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.JobHandle;
import com.cario.insight.app.model.JobStatus;
import com.cario.insight.app.model.StoredImage;
import com.cario.insight.app.repository.InsightRecordStore;
import com.cario.insight.app.service.ImageUploadService;
import com.cario.insight.app.service.InsightQueryService;
import com.cario.insight.app.storage.ImageStorage;
import jakarta.validation.constraints.NotNull;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST surface of the image insight service.
 *
 * <p>Endpoints under {@code /api}:
 *
 * <ul>
 *   <li>{@code GET /health} - reachability of the result store and image storage.
 *   <li>{@code POST /analyze} - accepts an image upload and returns a job handle.
 *   <li>{@code GET /results/{id}} - job status, and insights once completed.
 *   <li>{@code GET /image/{id}/original|annotated} - stored image bytes.
 *   <li>{@code GET /image/{id}/url?variant=original|annotated} - public or signed link.
 * </ul>
 *
 * <p>Errors are mapped to JSON bodies by {@link ApiExceptionHandler}.
 *
 * @author Shaji Nair
 * @version 1.0
 * @since 2025-10-02
 */
@Log4j2
@Validated
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InsightController {

  private final ImageUploadService uploadService;
  private final InsightQueryService queryService;
  private final InsightRecordStore recordStore;
  private final ImageStorage imageStorage;

  // ------------------------------------------------------------
  // /api/health
  // ------------------------------------------------------------
  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> health() {
    boolean storeUp = recordStore.isAvailable();
    boolean storageUp = imageStorage.isAvailable();
    boolean healthy = storeUp && storageUp;

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", healthy ? "ok" : "degraded");
    body.put("result_store", storeUp ? "up" : "down");
    body.put("storage", storageUp ? "up" : "down");
    return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
        .body(body);
  }

  // ------------------------------------------------------------
  // /api/analyze
  // ------------------------------------------------------------
  /**
   * Accepts an image for analysis. Validation runs before anything is stored.
   *
   * @param image multipart part named {@code image}
   * @return 202 with the job id to poll
   */
  @PostMapping(
      path = "/analyze",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<JobHandle> analyze(@RequestPart("image") @NotNull MultipartFile image) {
    log.info(
        "api.analyze filename={} size={} contentType={}",
        image.getOriginalFilename(),
        image.getSize(),
        image.getContentType());
    byte[] bytes;
    try {
      bytes = image.getBytes();
    } catch (IOException e) {
      throw new ValidationException("Could not read uploaded file: " + e.getMessage());
    }
    JobHandle handle = uploadService.submit(bytes, image.getOriginalFilename());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(handle);
  }

  // ------------------------------------------------------------
  // /api/results/{id}
  // ------------------------------------------------------------
  /** 202 while the job is processing, 200 once it is terminal. */
  @GetMapping(path = "/results/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<InsightRecord> result(@PathVariable("id") String id) {
    InsightRecord record = queryService.getResult(id);
    HttpStatus status =
        record.getStatus() == JobStatus.PROCESSING ? HttpStatus.ACCEPTED : HttpStatus.OK;
    return ResponseEntity.status(status).body(record);
  }

  // ------------------------------------------------------------
  // /api/image/{id}/original | annotated | url
  // ------------------------------------------------------------
  @GetMapping(path = "/image/{id}/original")
  public ResponseEntity<byte[]> original(@PathVariable("id") String id) {
    return image(queryService.getOriginal(id));
  }

  @GetMapping(path = "/image/{id}/annotated")
  public ResponseEntity<byte[]> annotated(@PathVariable("id") String id) {
    return image(queryService.getAnnotated(id));
  }

  @GetMapping(path = "/image/{id}/url", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, String>> imageUrl(
      @PathVariable("id") String id,
      @RequestParam(name = "variant", defaultValue = "original") String variant) {
    boolean annotated = "annotated".equalsIgnoreCase(variant);
    if (!annotated && !"original".equalsIgnoreCase(variant)) {
      throw new ValidationException("variant must be 'original' or 'annotated'");
    }
    String url =
        queryService
            .imageUrl(id, annotated)
            .orElseThrow(() -> new JobNotFoundException("No URL available for " + id));
    return ResponseEntity.ok(Map.of("url", url));
  }

  private static ResponseEntity<byte[]> image(StoredImage stored) {
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(stored.contentType()))
        .contentLength(stored.bytes().length)
        .body(stored.bytes());
  }
}
