package com.cario.insight.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client-visible result of one job.
 *
 * <p>Owned by the orchestrator while {@code processing}; read-only once it reaches {@code
 * completed} or {@code failed}. {@code insights} is only present on completed records.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
  "id",
  "status",
  "reason",
  "failed_analyzers",
  "created_at",
  "updated_at",
  "processing_time_ms",
  "insights"
})
public class InsightRecord {

  @JsonProperty("id")
  private String jobId;

  private JobStatus status;

  /** Set only when {@code status == failed}. */
  private FailureReason reason;

  /** Analyzers whose fields were degraded to null in a completed record. */
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  private List<AnalyzerKind> failedAnalyzers;

  private Instant createdAt;
  private Instant updatedAt;
  private Long processingTimeMs;

  private Insights insights;

  @JsonIgnore private ImageAsset asset;

  public static InsightRecord processing(ImageAsset asset, Instant now) {
    return InsightRecord.builder()
        .jobId(asset.getId())
        .status(JobStatus.PROCESSING)
        .createdAt(now)
        .updatedAt(now)
        .asset(asset)
        .build();
  }
}
