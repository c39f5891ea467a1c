package com.cario.insight.app.repository;

import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.FailureReason;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.Insights;
import com.cario.insight.app.model.JobStatus;
import com.cario.insight.app.repository.dynamodb.InsightRecordItem;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import lombok.extern.log4j.Log4j2;

/** Process-local store for development and tests. Records are lost on restart. */
@Log4j2
public class InMemoryInsightRecordStore implements InsightRecordStore {

  private final Map<String, InsightRecordItem> rows = new ConcurrentHashMap<>();
  private final InsightRecordMapper mapper;
  private final Clock clock;

  public InMemoryInsightRecordStore(InsightRecordMapper mapper, Clock clock) {
    this.mapper = mapper;
    this.clock = clock;
  }

  @Override
  public boolean createIfAbsent(InsightRecord record) {
    InsightRecordItem row = mapper.toItem(record);
    boolean created = rows.putIfAbsent(row.getJobId(), row) == null;
    log.debug("store.create jobId={} created={}", row.getJobId(), created);
    return created;
  }

  @Override
  public Optional<InsightRecord> find(String jobId) {
    if (jobId == null) return Optional.empty();
    InsightRecordItem row = rows.get(jobId);
    return row == null ? Optional.empty() : Optional.of(mapper.toRecord(row));
  }

  @Override
  public boolean markCompleted(
      String jobId,
      Insights insights,
      List<AnalyzerKind> failedAnalyzers,
      String annotatedKey,
      long processingTimeMs) {
    String json = mapper.writeInsights(insights);
    return transition(
        jobId,
        row ->
            row.toBuilder()
                .status(JobStatus.COMPLETED.code())
                .insightsJson(json)
                .failedAnalyzers(InsightRecordMapper.codes(failedAnalyzers))
                .annotatedKey(annotatedKey)
                .processingTimeMs(processingTimeMs)
                .updatedAt(Instant.now(clock))
                .build());
  }

  @Override
  public boolean markFailed(String jobId, FailureReason reason, long processingTimeMs) {
    return transition(
        jobId,
        row ->
            row.toBuilder()
                .status(JobStatus.FAILED.code())
                .reason(reason.code())
                .insightsJson(null)
                .failedAnalyzers(null)
                .processingTimeMs(processingTimeMs)
                .updatedAt(Instant.now(clock))
                .build());
  }

  @Override
  public List<InsightRecord> findProcessingCreatedBefore(Instant cutoff) {
    List<InsightRecord> out = new ArrayList<>();
    for (InsightRecordItem row : rows.values()) {
      if (JobStatus.PROCESSING.code().equals(row.getStatus())
          && row.getCreatedAt() != null
          && row.getCreatedAt().isBefore(cutoff)) {
        out.add(mapper.toRecord(row));
      }
    }
    return out;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  public int size() {
    return rows.size();
  }

  /** Applies the update only while the row is still processing. */
  private boolean transition(String jobId, UnaryOperator<InsightRecordItem> update) {
    AtomicBoolean applied = new AtomicBoolean(false);
    rows.computeIfPresent(
        jobId,
        (id, row) -> {
          if (!JobStatus.PROCESSING.code().equals(row.getStatus())) {
            return row;
          }
          applied.set(true);
          return update.apply(row);
        });
    if (!applied.get()) {
      log.warn("store.transition skipped jobId={} (missing or terminal)", jobId);
    }
    return applied.get();
  }
}
