package com.cario.insight.app.config;

import com.cario.insight.app.analyzer.AnalyzerSuite;
import com.cario.insight.app.analyzer.ColorAnalyzer;
import com.cario.insight.app.analyzer.FaceDetector;
import com.cario.insight.app.analyzer.FaceLocator;
import com.cario.insight.app.analyzer.ImageDecoder;
import com.cario.insight.app.analyzer.OcrEngine;
import com.cario.insight.app.analyzer.OpenCvFaceLocator;
import com.cario.insight.app.analyzer.QualityAnalyzer;
import com.cario.insight.app.analyzer.SceneDetector;
import com.cario.insight.app.analyzer.SkinRegionFaceLocator;
import com.cario.insight.app.analyzer.TesseractOcrEngine;
import com.cario.insight.app.analyzer.TextExtractor;
import com.cario.insight.app.queue.ExecutorJobQueue;
import com.cario.insight.app.queue.JobQueue;
import com.cario.insight.app.repository.InMemoryInsightRecordStore;
import com.cario.insight.app.repository.InsightRecordMapper;
import com.cario.insight.app.repository.InsightRecordStore;
import com.cario.insight.app.repository.dynamodb.DynamoDbInsightRecordStore;
import com.cario.insight.app.service.AnnotationService;
import com.cario.insight.app.service.ImageUploadService;
import com.cario.insight.app.service.ImageValidationService;
import com.cario.insight.app.service.InsightAggregator;
import com.cario.insight.app.service.InsightPipelineService;
import com.cario.insight.app.service.InsightQueryService;
import com.cario.insight.app.storage.ImageStorage;
import com.cario.insight.app.storage.LocalFileImageStorage;
import com.cario.insight.app.storage.RetryingImageStorage;
import com.cario.insight.app.storage.S3ImageStorage;
import java.nio.file.Paths;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Application wiring for the image insight service.
 *
 * <p>Builds the beans behind the upload and analysis flow from {@link InsightProperties}:
 *
 * <ul>
 *   <li>{@link ImageStorage} - local disk or S3, wrapped with retries.
 *   <li>{@link InsightRecordStore} - in-memory or DynamoDB job records.
 *   <li>{@link AnalyzerSuite} - the five analyzers, backed by OpenCV and Tesseract.
 *   <li>{@link InsightPipelineService} and {@link JobQueue} - asynchronous job execution.
 * </ul>
 *
 * <p>AWS clients come from {@link AwsLocalConfig} or {@link AwsProdConfig} and are only resolved
 * when a backend needs them.
 *
 * @author Shaji Nair
 * @version 1.0
 * @since 2025-10-02
 */
@Log4j2
@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final InsightProperties props;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Content-sniffing decoder with the configured pixel ceiling.
   *
   * @return an {@link ImageDecoder} shared by upload validation and the pipeline
   */
  @Bean
  public ImageDecoder imageDecoder() {
    return new ImageDecoder(props.getUpload().getMaxPixels());
  }

  // -------------------
  // Storage + result store
  // -------------------

  /**
   * Creates the image store selected by {@code insight.storage.type}.
   *
   * @return S3 or local-disk storage with retries on transient failures
   */
  @Bean
  public ImageStorage imageStorage(
      ObjectProvider<S3Client> s3Client, ObjectProvider<S3Presigner> s3Presigner) {
    InsightProperties.Storage cfg = props.getStorage();
    ImageStorage backend;
    if ("s3".equalsIgnoreCase(cfg.getType())) {
      backend =
          new S3ImageStorage(
              s3Client.getObject(),
              s3Presigner.getIfAvailable(),
              cfg.getS3().getBucket(),
              cfg.getS3().getPrefix(),
              cfg.getS3().getPublicDomain());
    } else {
      backend = new LocalFileImageStorage(Paths.get(cfg.getLocalRoot()), cfg.getPublicBaseUrl());
    }
    log.info("storage.backend type={}", cfg.getType());
    return new RetryingImageStorage(
        backend, cfg.getRetry().getMaxAttempts(), cfg.getRetry().getInitialBackoff());
  }

  @Bean
  public InsightRecordMapper insightRecordMapper() {
    return new InsightRecordMapper();
  }

  /**
   * Creates the job record store selected by {@code insight.result-store.type}.
   *
   * @return a DynamoDB-backed store, or an in-memory one for local runs
   */
  @Bean
  public InsightRecordStore insightRecordStore(
      InsightRecordMapper mapper, ObjectProvider<DynamoDbClient> ddb, Clock clock) {
    InsightProperties.ResultStore cfg = props.getResultStore();
    log.info("resultStore.backend type={} table={}", cfg.getType(), cfg.getTable());
    if ("dynamodb".equalsIgnoreCase(cfg.getType())) {
      return new DynamoDbInsightRecordStore(ddb.getObject(), cfg.getTable(), mapper, clock);
    }
    return new InMemoryInsightRecordStore(mapper, clock);
  }

  // -------------------
  // Analyzers
  // -------------------

  /**
   * Face locator selected by {@code insight.face.locator}: the OpenCV Haar cascade by default, the
   * skin-region heuristic only when {@code skin} is set explicitly.
   *
   * @return the configured {@link FaceLocator}
   */
  @Bean
  public FaceLocator faceLocator() {
    InsightProperties.Face face = props.getFace();
    if ("skin".equalsIgnoreCase(face.getLocator())) {
      log.info("face.locator type=skin-region");
      return new SkinRegionFaceLocator();
    }
    if (!"opencv".equalsIgnoreCase(face.getLocator())) {
      throw new IllegalStateException("Unknown insight.face.locator: " + face.getLocator());
    }
    String cascade = face.getCascadePath();
    if (cascade == null || cascade.isBlank()) {
      cascade = OpenCvFaceLocator.DEFAULT_CASCADE;
    }
    log.info("face.locator type=opencv cascade={}", cascade);
    return new OpenCvFaceLocator(cascade);
  }

  /** Tesseract through Tess4J, reading tessdata from {@code insight.ocr.data-path}. */
  @Bean
  public OcrEngine ocrEngine() {
    return new TesseractOcrEngine(props.getOcr().getDataPath(), props.getOcr().getLanguage());
  }

  @Bean
  public AnalyzerSuite analyzerSuite(FaceLocator faceLocator, OcrEngine ocrEngine) {
    InsightProperties.Color color = props.getColor();
    return new AnalyzerSuite(
        new ColorAnalyzer(color.getClusters(), color.getMaxIterations(), color.getSampleLimit()),
        new QualityAnalyzer(),
        new FaceDetector(faceLocator),
        new TextExtractor(ocrEngine),
        new SceneDetector());
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public AnnotationService annotationService(ImageStorage imageStorage) {
    return new AnnotationService(imageStorage);
  }

  /**
   * Job pipeline. Its stages run on the analyzer pool so that a timed-out stage can be interrupted
   * and its thread reclaimed.
   *
   * @return the {@link InsightPipelineService} driven by the job queue
   */
  @Bean
  public InsightPipelineService insightPipelineService(
      ImageStorage imageStorage,
      ImageDecoder imageDecoder,
      AnalyzerSuite analyzerSuite,
      AnnotationService annotationService,
      InsightRecordStore insightRecordStore,
      @Qualifier("insightAnalyzerExecutor") ThreadPoolTaskExecutor analyzerExecutor) {
    return new InsightPipelineService(
        imageStorage,
        imageDecoder,
        analyzerSuite,
        new InsightAggregator(),
        annotationService,
        insightRecordStore,
        analyzerExecutor.getThreadPoolExecutor(),
        props.getPipeline().getJobTimeout(),
        props.getPipeline().isRenderEmptyAnnotations());
  }

  @Bean
  public JobQueue jobQueue(
      @Qualifier("insightWorkerExecutor") ThreadPoolTaskExecutor workerExecutor,
      InsightPipelineService pipeline) {
    return new ExecutorJobQueue(workerExecutor, pipeline);
  }

  @Bean
  public ImageValidationService imageValidationService(ImageDecoder imageDecoder) {
    return new ImageValidationService(
        props.getUpload().getMaxSizeBytes(),
        props.getUpload().getMaxPixels(),
        props.getUpload().getAllowedExtensions(),
        imageDecoder);
  }

  @Bean
  public ImageUploadService imageUploadService(
      ImageValidationService validation,
      ImageStorage imageStorage,
      InsightRecordStore insightRecordStore,
      JobQueue jobQueue,
      Clock clock) {
    return new ImageUploadService(validation, imageStorage, insightRecordStore, jobQueue, clock);
  }

  @Bean
  public InsightQueryService insightQueryService(
      InsightRecordStore insightRecordStore, ImageStorage imageStorage) {
    return new InsightQueryService(
        insightRecordStore, imageStorage, props.getStorage().getS3().getPresignTtl());
  }
}
