package com.cario.insight.app.repository;

import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.FailureReason;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.Insights;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of insight records keyed by job id.
 *
 * <p>Terminal transitions are conditional on the record still being {@code processing}, so each
 * record leaves that state exactly once and is never mutated afterwards. The insights payload is
 * written in the same single update as the {@code completed} status.
 */
public interface InsightRecordStore {

  /** @return false when a record with the same job id already exists */
  boolean createIfAbsent(InsightRecord record);

  Optional<InsightRecord> find(String jobId);

  /** @return false when the record is unknown or already terminal */
  boolean markCompleted(
      String jobId,
      Insights insights,
      List<AnalyzerKind> failedAnalyzers,
      String annotatedKey,
      long processingTimeMs);

  /** @return false when the record is unknown or already terminal */
  boolean markFailed(String jobId, FailureReason reason, long processingTimeMs);

  List<InsightRecord> findProcessingCreatedBefore(Instant cutoff);

  boolean isAvailable();
}
