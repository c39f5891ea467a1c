package com.cario.insight.app.service;

import com.cario.insight.app.analyzer.AnalyzerSuite;
import com.cario.insight.app.analyzer.DecodedImage;
import com.cario.insight.app.analyzer.ImageAnalyzer;
import com.cario.insight.app.analyzer.ImageDecoder;
import com.cario.insight.app.exception.DecodeException;
import com.cario.insight.app.exception.JobNotFoundException;
import com.cario.insight.app.exception.PipelineException;
import com.cario.insight.app.exception.StorageException;
import com.cario.insight.app.model.AnalyzerOutcome;
import com.cario.insight.app.model.ColorResult;
import com.cario.insight.app.model.FaceBox;
import com.cario.insight.app.model.FaceResult;
import com.cario.insight.app.model.FailureReason;
import com.cario.insight.app.model.ImageAsset;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.Insights;
import com.cario.insight.app.model.JobStatus;
import com.cario.insight.app.model.QualityResult;
import com.cario.insight.app.model.SceneResult;
import com.cario.insight.app.model.TextResult;
import com.cario.insight.app.repository.InsightRecordStore;
import com.cario.insight.app.storage.ImageStorage;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.log4j.Log4j2;

/**
 * Drives one job from the stored original to a terminal insight record.
 *
 * <p>Flow: fetch and decode, five analyzers in parallel, aggregate, annotate, then one atomic
 * {@code completed} write. Job-level failures (decode, storage, timeout, every analyzer failing)
 * end in {@code failed} with a reason code; single analyzer failures only null out their fields.
 * Every exit path leaves the record terminal, including {@link Error}s, which are rethrown after
 * the failed write.
 *
 * <p>The job budget covers every stage. Each stage runs as a {@link Future} on the stage pool and
 * is awaited through a {@link TimeLimiter} sized to what is left of the budget; on timeout the
 * running stages are cancelled with an interrupt so their threads return to the pool. An annotated
 * copy written by a job that does not end {@code completed} is deleted.
 */
@Log4j2
public class InsightPipelineService {

  private final ImageStorage storage;
  private final ImageDecoder decoder;
  private final AnalyzerSuite analyzers;
  private final InsightAggregator aggregator;
  private final AnnotationService annotation;
  private final InsightRecordStore store;
  private final ExecutorService stageExecutor;
  private final Duration jobTimeout;
  private final boolean renderEmptyAnnotations;

  public InsightPipelineService(
      ImageStorage storage,
      ImageDecoder decoder,
      AnalyzerSuite analyzers,
      InsightAggregator aggregator,
      AnnotationService annotation,
      InsightRecordStore store,
      ExecutorService stageExecutor,
      Duration jobTimeout,
      boolean renderEmptyAnnotations) {
    this.storage = storage;
    this.decoder = decoder;
    this.analyzers = analyzers;
    this.aggregator = aggregator;
    this.annotation = annotation;
    this.store = store;
    this.stageExecutor = stageExecutor;
    this.jobTimeout = jobTimeout;
    this.renderEmptyAnnotations = renderEmptyAnnotations;
  }

  /**
   * Runs the job to a terminal state.
   *
   * @return the terminal status, or the existing one when the record was already terminal
   * @throws JobNotFoundException if no record exists for the id
   */
  public JobStatus process(String jobId) {
    final long startNanos = System.nanoTime();
    final long deadline = startNanos + jobTimeout.toNanos();

    InsightRecord record =
        store.find(jobId).orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
    if (record.getStatus().isTerminal()) {
      log.info("pipeline.skip jobId={} status={}", jobId, record.getStatus().code());
      return record.getStatus();
    }
    ImageAsset asset = record.getAsset();
    log.info(
        "pipeline.start jobId={} key={} timeoutMs={}",
        jobId,
        asset.getOriginalKey(),
        jobTimeout.toMillis());

    List<Future<?>> inFlight = new ArrayList<>();
    String annotatedKey = null;
    try {
      // 1) Fetch + decode
      DecodedImage image =
          await(
              start(inFlight, () -> decoder.decode(storage.fetch(asset.getOriginalKey()))),
              deadline);
      log.info(
          "pipeline.decoded jobId={} format={} size={}x{}",
          jobId,
          image.format(),
          image.width(),
          image.height());

      // 2) Analyzers
      AnalysisOutcomes outcomes = runAnalyzers(jobId, image, deadline, inFlight);
      if (outcomes.allFailed()) {
        log.error("pipeline.allAnalyzersFailed jobId={}", jobId);
        return fail(jobId, FailureReason.PIPELINE_ERROR, startNanos);
      }

      // 3) Aggregate + annotate
      Insights insights = aggregator.aggregate(jobId, outcomes);
      List<FaceBox> faces = outcomes.faceBoxes();
      if (!faces.isEmpty() || renderEmptyAnnotations) {
        annotatedKey = annotation.keyFor(asset, image);
        annotatedKey = annotate(jobId, asset, image, faces, deadline, inFlight, annotatedKey);
      } else {
        log.debug("pipeline.annotate skipped jobId={} faces=0", jobId);
      }

      if (System.nanoTime() > deadline) {
        throw new TimeoutException("budget exhausted before the final write");
      }

      // 4) Single terminal write
      long elapsedMs = elapsedMs(startNanos);
      boolean written =
          store.markCompleted(jobId, insights, outcomes.failedKinds(), annotatedKey, elapsedMs);
      if (!written) {
        discard(jobId, annotatedKey);
      }
      log.info(
          "pipeline.done jobId={} status=completed written={} failed={} elapsedMs={}",
          jobId,
          written,
          outcomes.failedKinds(),
          elapsedMs);
      return currentStatus(jobId, JobStatus.COMPLETED, written);

    } catch (TimeoutException e) {
      log.warn("pipeline.timeout jobId={} msg={}", jobId, e.getMessage());
      return abort(jobId, FailureReason.TIMEOUT, inFlight, annotatedKey, startNanos);
    } catch (DecodeException e) {
      log.warn("pipeline.decodeError jobId={} msg={}", jobId, e.getMessage());
      return abort(jobId, FailureReason.DECODE_ERROR, inFlight, annotatedKey, startNanos);
    } catch (StorageException e) {
      log.error("pipeline.storageError jobId={} msg={}", jobId, e.getMessage(), e);
      return abort(jobId, FailureReason.STORAGE_ERROR, inFlight, annotatedKey, startNanos);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("pipeline.interrupted jobId={}", jobId);
      return abort(jobId, FailureReason.PIPELINE_ERROR, inFlight, annotatedKey, startNanos);
    } catch (RuntimeException e) {
      log.error("pipeline.error jobId={} msg={}", jobId, e.getMessage(), e);
      return abort(jobId, FailureReason.PIPELINE_ERROR, inFlight, annotatedKey, startNanos);
    } catch (Error e) {
      log.error("pipeline.fatal jobId={} error={}", jobId, describe(e), e);
      abort(jobId, FailureReason.PIPELINE_ERROR, inFlight, annotatedKey, startNanos);
      throw e;
    }
  }

  // ------------------ Stages ------------------

  private <T> Future<T> start(List<Future<?>> inFlight, Callable<T> stage) {
    Future<T> future = stageExecutor.submit(stage);
    inFlight.add(future);
    return future;
  }

  /**
   * Waits for a stage within what is left of the budget. Stage failures surface as the exception
   * the stage threw.
   */
  private static <T> T await(Future<T> future, long deadline)
      throws TimeoutException, InterruptedException {
    long remaining = deadline - System.nanoTime();
    if (remaining <= 0) {
      future.cancel(true);
      throw new TimeoutException("budget exhausted");
    }
    TimeLimiter limiter =
        TimeLimiter.of(
            TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofNanos(remaining))
                .cancelRunningFuture(true)
                .build());
    try {
      return limiter.executeFutureSupplier(() -> future);
    } catch (TimeoutException | InterruptedException | RuntimeException e) {
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw new PipelineException("Stage failed: " + describe(e), cause);
    } catch (Exception e) {
      throw new PipelineException("Stage failed: " + describe(e), e);
    }
  }

  private AnalysisOutcomes runAnalyzers(
      String jobId, DecodedImage image, long deadline, List<Future<?>> inFlight)
      throws TimeoutException, InterruptedException {
    Future<AnalyzerOutcome<ColorResult>> color =
        start(inFlight, analyze(jobId, analyzers.color(), image));
    Future<AnalyzerOutcome<QualityResult>> quality =
        start(inFlight, analyze(jobId, analyzers.quality(), image));
    Future<AnalyzerOutcome<FaceResult>> face =
        start(inFlight, analyze(jobId, analyzers.face(), image));
    Future<AnalyzerOutcome<TextResult>> text =
        start(inFlight, analyze(jobId, analyzers.text(), image));
    Future<AnalyzerOutcome<SceneResult>> scene =
        start(inFlight, analyze(jobId, analyzers.scene(), image));

    return new AnalysisOutcomes(
        await(color, deadline),
        await(quality, deadline),
        await(face, deadline),
        await(text, deadline),
        await(scene, deadline));
  }

  /** Analyzer exceptions become a failed outcome; only errors escape. */
  private static <T> Callable<AnalyzerOutcome<T>> analyze(
      String jobId, ImageAnalyzer<T> analyzer, DecodedImage image) {
    return () -> {
      try {
        T value = analyzer.analyze(image);
        if (value != null) {
          return AnalyzerOutcome.ok(analyzer.kind(), value);
        }
        return failed(jobId, analyzer, "analyzer returned no result");
      } catch (RuntimeException e) {
        return failed(jobId, analyzer, describe(e));
      }
    };
  }

  private static <T> AnalyzerOutcome<T> failed(
      String jobId, ImageAnalyzer<T> analyzer, String error) {
    log.warn(
        "pipeline.analyzerFailed jobId={} analyzer={} msg={}",
        jobId,
        analyzer.kind().code(),
        error);
    return AnalyzerOutcome.failed(analyzer.kind(), error);
  }

  // ------------------ Annotation ------------------

  /**
   * Non-fatal unless the budget runs out: returns null when rendering fails.
   *
   * @throws TimeoutException when rendering outlives the job budget
   */
  private String annotate(
      String jobId,
      ImageAsset asset,
      DecodedImage image,
      List<FaceBox> faces,
      long deadline,
      List<Future<?>> inFlight,
      String key)
      throws TimeoutException, InterruptedException {
    try {
      return await(start(inFlight, () -> annotation.render(asset, image, faces)), deadline);
    } catch (RuntimeException e) {
      log.warn("pipeline.annotate failed jobId={} msg={}", jobId, e.getMessage(), e);
      discard(jobId, key);
      return null;
    }
  }

  /** Best-effort removal of a derived image that will not be referenced by a completed record. */
  private void discard(String jobId, String annotatedKey) {
    if (annotatedKey == null) {
      return;
    }
    try {
      storage.delete(annotatedKey);
      log.info("pipeline.annotate discarded jobId={} key={}", jobId, annotatedKey);
    } catch (RuntimeException e) {
      log.warn(
          "pipeline.annotate discard failed jobId={} key={} msg={}",
          jobId,
          annotatedKey,
          e.getMessage());
    }
  }

  // ------------------ Helpers ------------------

  private JobStatus abort(
      String jobId,
      FailureReason reason,
      List<Future<?>> inFlight,
      String annotatedKey,
      long startNanos) {
    inFlight.forEach(f -> f.cancel(true));
    discard(jobId, annotatedKey);
    return fail(jobId, reason, startNanos);
  }

  private JobStatus fail(String jobId, FailureReason reason, long startNanos) {
    long elapsedMs = elapsedMs(startNanos);
    boolean written = store.markFailed(jobId, reason, elapsedMs);
    log.info(
        "pipeline.done jobId={} status=failed reason={} written={} elapsedMs={}",
        jobId,
        reason.code(),
        written,
        elapsedMs);
    return currentStatus(jobId, JobStatus.FAILED, written);
  }

  /** When another writer won the transition, report what the store actually holds. */
  private JobStatus currentStatus(String jobId, JobStatus intended, boolean written) {
    if (written) return intended;
    return store.find(jobId).map(InsightRecord::getStatus).orElse(intended);
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private static String describe(Throwable t) {
    String msg = t.getMessage();
    return t.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
  }
}
