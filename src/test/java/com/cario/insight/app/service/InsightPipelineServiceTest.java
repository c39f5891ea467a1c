package com.cario.insight.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.insight.app.TestImages;
import com.cario.insight.app.analyzer.AnalyzerSuite;
import com.cario.insight.app.analyzer.ColorAnalyzer;
import com.cario.insight.app.analyzer.DecodedImage;
import com.cario.insight.app.analyzer.FaceDetector;
import com.cario.insight.app.analyzer.FaceLocator;
import com.cario.insight.app.analyzer.ImageAnalyzer;
import com.cario.insight.app.analyzer.ImageDecoder;
import com.cario.insight.app.analyzer.OcrEngine;
import com.cario.insight.app.analyzer.QualityAnalyzer;
import com.cario.insight.app.analyzer.SceneDetector;
import com.cario.insight.app.analyzer.SkinRegionFaceLocator;
import com.cario.insight.app.analyzer.TextExtractor;
import com.cario.insight.app.exception.AnalyzerException;
import com.cario.insight.app.exception.JobNotFoundException;
import com.cario.insight.app.exception.StorageNotFoundException;
import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.BlurLevel;
import com.cario.insight.app.model.FaceBox;
import com.cario.insight.app.model.FailureReason;
import com.cario.insight.app.model.ImageAsset;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.Insights;
import com.cario.insight.app.model.JobStatus;
import com.cario.insight.app.model.SceneResult;
import com.cario.insight.app.model.SceneType;
import com.cario.insight.app.repository.InMemoryInsightRecordStore;
import com.cario.insight.app.repository.InsightRecordMapper;
import com.cario.insight.app.storage.LocalFileImageStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InsightPipelineServiceTest {

  private static final int GRAY = 0x808080;

  @TempDir Path root;

  private LocalFileImageStorage storage;
  private InMemoryInsightRecordStore store;
  private ExecutorService analyzerPool;
  private InsightQueryService query;

  @BeforeEach
  void setUp() {
    storage = new LocalFileImageStorage(root, null);
    store = new InMemoryInsightRecordStore(new InsightRecordMapper(), Clock.systemUTC());
    analyzerPool = Executors.newFixedThreadPool(5);
    query = new InsightQueryService(store, storage, Duration.ofHours(1));
  }

  @AfterEach
  void tearDown() {
    analyzerPool.shutdownNow();
  }

  // ------------------ fixtures ------------------

  private String submit(byte[] bytes) {
    return submitWithKey(storage.save(bytes, "img.png"));
  }

  private String submitWithKey(String key) {
    String id = UUID.randomUUID().toString();
    ImageAsset asset =
        ImageAsset.builder().id(id).filename("img.png").originalKey(key).format("png").build();
    store.createIfAbsent(InsightRecord.processing(asset, Instant.now()));
    return id;
  }

  private InsightPipelineService pipeline(AnalyzerSuite suite, Duration timeout, boolean renderEmpty) {
    return pipeline(
        new ImageDecoder(), suite, new AnnotationService(storage), store, timeout, renderEmpty);
  }

  private InsightPipelineService pipeline(
      ImageDecoder decoder,
      AnalyzerSuite suite,
      AnnotationService annotation,
      InMemoryInsightRecordStore records,
      Duration timeout,
      boolean renderEmpty) {
    return new InsightPipelineService(
        storage,
        decoder,
        suite,
        new InsightAggregator(),
        annotation,
        records,
        analyzerPool,
        timeout,
        renderEmpty);
  }

  private InsightPipelineService healthy() {
    return pipeline(suite(new SkinRegionFaceLocator(), img -> ""), Duration.ofSeconds(30), false);
  }

  /** Scene analyzer that blocks until interrupted; the latch is never released. */
  private static ImageAnalyzer<SceneResult> blockingScene(
      CountDownLatch never, AtomicInteger interrupted) {
    return new ImageAnalyzer<>() {
      @Override
      public AnalyzerKind kind() {
        return AnalyzerKind.SCENE;
      }

      @Override
      public SceneResult analyze(DecodedImage image) {
        try {
          never.await();
        } catch (InterruptedException e) {
          interrupted.incrementAndGet();
          Thread.currentThread().interrupt();
          throw new IllegalStateException("interrupted");
        }
        return new SceneResult(SceneType.UNKNOWN, 0.5);
      }
    };
  }

  private static AnalyzerSuite withScene(ImageAnalyzer<SceneResult> scene) {
    return new AnalyzerSuite(
        new ColorAnalyzer(5, 20, 40_000),
        new QualityAnalyzer(),
        new FaceDetector(new SkinRegionFaceLocator()),
        new TextExtractor(img -> ""),
        scene);
  }

  private static void awaitCount(AtomicInteger counter, int expected) throws InterruptedException {
    long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (counter.get() < expected && System.nanoTime() < until) {
      Thread.sleep(10);
    }
    assertEquals(expected, counter.get());
  }

  private static AnalyzerSuite suite(FaceLocator faces, OcrEngine ocr) {
    return new AnalyzerSuite(
        new ColorAnalyzer(5, 20, 40_000),
        new QualityAnalyzer(),
        new FaceDetector(faces),
        new TextExtractor(ocr),
        new SceneDetector());
  }

  private static FaceLocator fixedFaces(List<FaceBox> boxes) {
    return new FaceLocator() {
      @Override
      public List<FaceBox> locate(DecodedImage image) {
        return boxes;
      }

      @Override
      public String name() {
        return "fixed";
      }
    };
  }

  private static <T> ImageAnalyzer<T> failing(AnalyzerKind kind) {
    return new ImageAnalyzer<T>() {
      @Override
      public AnalyzerKind kind() {
        return kind;
      }

      @Override
      public T analyze(DecodedImage image) {
        throw new AnalyzerException(kind, "runtime unavailable");
      }
    };
  }

  private static byte[] grayPng() {
    return TestImages.png(TestImages.solid(32, 32, GRAY));
  }

  // ------------------ tests ------------------

  @Test
  void solidGrayImageCompletesWithExpectedInsights() {
    String id = submit(grayPng());

    JobStatus status =
        pipeline(suite(new SkinRegionFaceLocator(), img -> ""), Duration.ofSeconds(30), false)
            .process(id);

    assertEquals(JobStatus.COMPLETED, status);
    InsightRecord r = query.getResult(id);
    Insights i = r.getInsights();
    assertEquals(5, i.getDominantColors().size());
    assertEquals(128, (int) i.getBrightness());
    assertEquals(0.0, i.getSharpnessScore(), 1e-9);
    assertEquals(BlurLevel.HIGH, i.getBlurLevel());
    assertEquals(0, (int) i.getFacesDetected());
    assertEquals(false, i.getTextFound());
    assertEquals(0, (int) i.getWordCount());
    assertEquals(SceneType.INDOOR, i.getSceneType());
    assertTrue(r.getFailedAnalyzers() == null || r.getFailedAnalyzers().isEmpty());
    assertNotNull(r.getProcessingTimeMs());
  }

  @Test
  void zeroFacesSkipsAnnotation() {
    String id = submit(grayPng());

    pipeline(suite(new SkinRegionFaceLocator(), img -> ""), Duration.ofSeconds(30), false)
        .process(id);

    assertNull(query.getResult(id).getAsset().getAnnotatedKey());
    assertThrows(JobNotFoundException.class, () -> query.getAnnotated(id));
  }

  @Test
  void zeroFacesRendersUnmodifiedCopyWhenConfigured() {
    String id = submit(grayPng());

    pipeline(suite(new SkinRegionFaceLocator(), img -> ""), Duration.ofSeconds(30), true)
        .process(id);

    BufferedImage annotated = TestImages.read(query.getAnnotated(id).bytes());
    assertEquals(32, annotated.getWidth());
    assertEquals(GRAY, annotated.getRGB(5, 5) & 0xFFFFFF);
  }

  @Test
  void detectedFacesProduceAnnotatedImage() {
    String id = submit(TestImages.png(TestImages.solid(20, 20, GRAY)));

    pipeline(
            suite(fixedFaces(List.of(new FaceBox(2, 2, 10, 10))), img -> ""),
            Duration.ofSeconds(30),
            false)
        .process(id);

    InsightRecord r = query.getResult(id);
    assertEquals(1, (int) r.getInsights().getFacesDetected());
    assertEquals(List.of(new FaceBox(2, 2, 10, 10)), r.getInsights().getFaceLocations());

    BufferedImage annotated = TestImages.read(query.getAnnotated(id).bytes());
    BufferedImage original = TestImages.read(query.getOriginal(id).bytes());
    int changed = 0;
    for (int y = 0; y < 20; y++) {
      for (int x = 0; x < 20; x++) {
        if ((annotated.getRGB(x, y) & 0xFFFFFF) == 0x00FF00) {
          changed++;
        }
        assertEquals(GRAY, original.getRGB(x, y) & 0xFFFFFF);
      }
    }
    assertTrue(changed > 0);
    assertEquals(GRAY, annotated.getRGB(19, 19) & 0xFFFFFF);
  }

  @Test
  void singleAnalyzerFailureDegradesOnlyItsFields() {
    String id = submit(grayPng());
    OcrEngine broken =
        img -> {
          throw new IllegalStateException("tessdata missing");
        };

    JobStatus status =
        pipeline(suite(new SkinRegionFaceLocator(), broken), Duration.ofSeconds(30), false)
            .process(id);

    assertEquals(JobStatus.COMPLETED, status);
    InsightRecord r = query.getResult(id);
    assertEquals(List.of(AnalyzerKind.TEXT), r.getFailedAnalyzers());
    assertNull(r.getInsights().getTextFound());
    assertNull(r.getInsights().getExtractedText());
    assertNull(r.getInsights().getWordCount());
    assertEquals(5, r.getInsights().getDominantColors().size());
  }

  @Test
  void allAnalyzersFailingIsPipelineError() {
    String id = submit(grayPng());
    AnalyzerSuite broken =
        new AnalyzerSuite(
            failing(AnalyzerKind.COLOR),
            failing(AnalyzerKind.QUALITY),
            failing(AnalyzerKind.FACE),
            failing(AnalyzerKind.TEXT),
            failing(AnalyzerKind.SCENE));

    JobStatus status = pipeline(broken, Duration.ofSeconds(30), false).process(id);

    assertEquals(JobStatus.FAILED, status);
    InsightRecord r = query.getResult(id);
    assertEquals(FailureReason.PIPELINE_ERROR, r.getReason());
    assertNull(r.getInsights());
  }

  @Test
  void corruptBytesAreDecodeError() {
    String id = submit("definitely not an image".getBytes(StandardCharsets.UTF_8));

    JobStatus status =
        pipeline(suite(new SkinRegionFaceLocator(), img -> ""), Duration.ofSeconds(30), false)
            .process(id);

    assertEquals(JobStatus.FAILED, status);
    assertEquals(FailureReason.DECODE_ERROR, query.getResult(id).getReason());
    assertNull(query.getResult(id).getInsights());
  }

  @Test
  void missingOriginalIsStorageError() {
    String id = submitWithKey("images/never-stored.png");

    JobStatus status =
        pipeline(suite(new SkinRegionFaceLocator(), img -> ""), Duration.ofSeconds(30), false)
            .process(id);

    assertEquals(JobStatus.FAILED, status);
    assertEquals(FailureReason.STORAGE_ERROR, query.getResult(id).getReason());
  }

  @Test
  void hangingAnalyzerIsInterruptedWhenBudgetRunsOut() throws Exception {
    assertEquals(JobStatus.COMPLETED, healthy().process(submit(grayPng())));
    String id = submit(grayPng());
    CountDownLatch never = new CountDownLatch(1);
    AtomicInteger interrupted = new AtomicInteger();
    Duration budget = Duration.ofMillis(500);

    long start = System.nanoTime();
    JobStatus status =
        pipeline(withScene(blockingScene(never, interrupted)), budget, false).process(id);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertEquals(JobStatus.FAILED, status);
    assertTrue(elapsedMs < budget.toMillis() + 2_000, "took " + elapsedMs + "ms");
    InsightRecord r = query.getResult(id);
    assertEquals(FailureReason.TIMEOUT, r.getReason());
    assertNull(r.getInsights());
    awaitCount(interrupted, 1);
  }

  @Test
  void timedOutJobsGiveTheirThreadsBack() throws Exception {
    assertEquals(JobStatus.COMPLETED, healthy().process(submit(grayPng())));
    CountDownLatch never = new CountDownLatch(1);
    AtomicInteger interrupted = new AtomicInteger();
    InsightPipelineService stuck =
        pipeline(
            withScene(blockingScene(never, interrupted)), Duration.ofMillis(500), false);

    // as many stuck jobs as the pool has threads
    for (int i = 0; i < 5; i++) {
      assertEquals(JobStatus.FAILED, stuck.process(submit(grayPng())));
    }
    awaitCount(interrupted, 5);

    String id = submit(grayPng());
    assertEquals(JobStatus.COMPLETED, healthy().process(id));
    assertEquals(5, query.getResult(id).getInsights().getDominantColors().size());
  }

  @Test
  void stalledDecodeCountsAgainstTheBudget() {
    String id = submit(grayPng());
    CountDownLatch never = new CountDownLatch(1);
    ImageDecoder stalled =
        new ImageDecoder() {
          @Override
          public DecodedImage decode(byte[] bytes) {
            try {
              never.await();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            throw new IllegalStateException("interrupted");
          }
        };

    long start = System.nanoTime();
    JobStatus status =
        pipeline(
                stalled,
                suite(new SkinRegionFaceLocator(), img -> ""),
                new AnnotationService(storage),
                store,
                Duration.ofMillis(300),
                false)
            .process(id);

    assertEquals(JobStatus.FAILED, status);
    assertEquals(FailureReason.TIMEOUT, query.getResult(id).getReason());
    assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 2_300);
  }

  @Test
  void decompressionBombFailsAsDecodeError() {
    String id = submit(TestImages.oversizedPng());

    JobStatus status = healthy().process(id);

    assertEquals(JobStatus.FAILED, status);
    assertEquals(FailureReason.DECODE_ERROR, query.getResult(id).getReason());
  }

  @Test
  void errorsStillLeaveTheRecordTerminal() {
    String id = submit(grayPng());
    ImageDecoder exhausted =
        new ImageDecoder() {
          @Override
          public DecodedImage decode(byte[] bytes) {
            throw new OutOfMemoryError("Java heap space");
          }
        };
    InsightPipelineService service =
        pipeline(
            exhausted,
            suite(new SkinRegionFaceLocator(), img -> ""),
            new AnnotationService(storage),
            store,
            Duration.ofSeconds(30),
            false);

    assertThrows(OutOfMemoryError.class, () -> service.process(id));

    InsightRecord r = query.getResult(id);
    assertEquals(JobStatus.FAILED, r.getStatus());
    assertEquals(FailureReason.PIPELINE_ERROR, r.getReason());
  }

  @Test
  void annotationOutlivingTheBudgetIsDeleted() throws Exception {
    assertEquals(JobStatus.COMPLETED, healthy().process(submit(grayPng())));
    String id = submit(TestImages.png(TestImages.solid(20, 20, GRAY)));
    CountDownLatch rendered = new CountDownLatch(1);
    CountDownLatch never = new CountDownLatch(1);
    AnnotationService slow =
        new AnnotationService(storage) {
          @Override
          public String render(ImageAsset asset, DecodedImage image, List<FaceBox> faces) {
            String key = super.render(asset, image, faces);
            rendered.countDown();
            try {
              never.await();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return key;
          }
        };

    JobStatus status =
        pipeline(
                new ImageDecoder(),
                suite(fixedFaces(List.of(new FaceBox(2, 2, 10, 10))), img -> ""),
                slow,
                store,
                Duration.ofSeconds(2),
                false)
            .process(id);

    assertEquals(JobStatus.FAILED, status);
    assertEquals(FailureReason.TIMEOUT, query.getResult(id).getReason());
    assertTrue(rendered.await(1, TimeUnit.SECONDS));
    ImageAsset asset = store.find(id).orElseThrow().getAsset();
    String annotatedKey =
        slow.keyFor(asset, TestImages.decoded(TestImages.solid(20, 20, GRAY)));
    assertThrows(StorageNotFoundException.class, () -> storage.fetch(annotatedKey));
    assertTrue(storage.fetch(asset.getOriginalKey()).length > 0);
  }

  @Test
  void annotationOfALostRaceIsDeleted() {
    InMemoryInsightRecordStore racing =
        new InMemoryInsightRecordStore(new InsightRecordMapper(), Clock.systemUTC()) {
          @Override
          public boolean markCompleted(
              String jobId,
              Insights insights,
              List<AnalyzerKind> failedAnalyzers,
              String annotatedKey,
              long processingTimeMs) {
            // the stale sweeper gets there first
            markFailed(jobId, FailureReason.TIMEOUT, processingTimeMs);
            return super.markCompleted(
                jobId, insights, failedAnalyzers, annotatedKey, processingTimeMs);
          }
        };
    String key = storage.save(TestImages.png(TestImages.solid(20, 20, GRAY)), "img.png");
    String id = UUID.randomUUID().toString();
    ImageAsset asset =
        ImageAsset.builder().id(id).filename("img.png").originalKey(key).format("png").build();
    racing.createIfAbsent(InsightRecord.processing(asset, Instant.now()));
    AnnotationService annotation = new AnnotationService(storage);

    JobStatus status =
        pipeline(
                new ImageDecoder(),
                suite(fixedFaces(List.of(new FaceBox(2, 2, 10, 10))), img -> ""),
                annotation,
                racing,
                Duration.ofSeconds(30),
                false)
            .process(id);

    assertEquals(JobStatus.FAILED, status);
    String annotatedKey =
        annotation.keyFor(asset, TestImages.decoded(TestImages.solid(20, 20, GRAY)));
    assertThrows(StorageNotFoundException.class, () -> storage.fetch(annotatedKey));
  }

  @Test
  void terminalRecordsAreNotReprocessed() throws Exception {
    String id = submit(grayPng());
    InsightPipelineService service =
        pipeline(suite(new SkinRegionFaceLocator(), img -> ""), Duration.ofSeconds(30), false);
    service.process(id);
    ObjectMapper om = new ObjectMapper();
    String before = om.writeValueAsString(query.getResult(id).getInsights());

    assertEquals(JobStatus.COMPLETED, service.process(id));
    assertEquals(before, om.writeValueAsString(query.getResult(id).getInsights()));
    assertEquals(before, om.writeValueAsString(query.getResult(id).getInsights()));
  }

  @Test
  void unknownJobIsNotFound() {
    InsightPipelineService service =
        pipeline(suite(new SkinRegionFaceLocator(), img -> ""), Duration.ofSeconds(30), false);

    assertThrows(JobNotFoundException.class, () -> service.process("missing"));
  }
}
