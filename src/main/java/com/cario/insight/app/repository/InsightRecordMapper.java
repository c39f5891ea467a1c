package com.cario.insight.app.repository;

import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.FailureReason;
import com.cario.insight.app.model.ImageAsset;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.Insights;
import com.cario.insight.app.model.JobStatus;
import com.cario.insight.app.repository.dynamodb.InsightRecordItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts between the domain record and its persisted row. The insights payload is kept as a JSON
 * string column, so repeated reads of a completed record return identical content.
 */
public class InsightRecordMapper {

  private final ObjectMapper om = new ObjectMapper();

  public InsightRecordItem toItem(InsightRecord record) {
    ImageAsset asset = record.getAsset() == null ? new ImageAsset() : record.getAsset();
    return InsightRecordItem.builder()
        .jobId(record.getJobId())
        .status(record.getStatus().code())
        .reason(record.getReason() == null ? null : record.getReason().code())
        .failedAnalyzers(codes(record.getFailedAnalyzers()))
        .insightsJson(writeInsights(record.getInsights()))
        .processingTimeMs(record.getProcessingTimeMs())
        .createdAt(record.getCreatedAt())
        .updatedAt(record.getUpdatedAt())
        .filename(asset.getFilename())
        .originalKey(asset.getOriginalKey())
        .annotatedKey(asset.getAnnotatedKey())
        .contentType(asset.getContentType())
        .format(asset.getFormat())
        .sizeBytes(asset.getSizeBytes())
        .checksum(asset.getChecksum())
        .width(asset.getWidth())
        .height(asset.getHeight())
        .uploadedAt(asset.getUploadedAt())
        .build();
  }

  public InsightRecord toRecord(InsightRecordItem item) {
    ImageAsset asset =
        ImageAsset.builder()
            .id(item.getJobId())
            .filename(item.getFilename())
            .originalKey(item.getOriginalKey())
            .annotatedKey(item.getAnnotatedKey())
            .contentType(item.getContentType())
            .format(item.getFormat())
            .sizeBytes(item.getSizeBytes() == null ? 0L : item.getSizeBytes())
            .checksum(item.getChecksum())
            .width(item.getWidth())
            .height(item.getHeight())
            .uploadedAt(item.getUploadedAt())
            .build();

    return InsightRecord.builder()
        .jobId(item.getJobId())
        .status(JobStatus.fromCode(item.getStatus()))
        .reason(item.getReason() == null ? null : FailureReason.fromCode(item.getReason()))
        .failedAnalyzers(kinds(item.getFailedAnalyzers()))
        .insights(readInsights(item.getInsightsJson()))
        .processingTimeMs(item.getProcessingTimeMs())
        .createdAt(item.getCreatedAt())
        .updatedAt(item.getUpdatedAt())
        .asset(asset)
        .build();
  }

  public String writeInsights(Insights insights) {
    if (insights == null) return null;
    try {
      return om.writeValueAsString(insights);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize insights", e);
    }
  }

  public Insights readInsights(String json) {
    if (json == null || json.isBlank()) return null;
    try {
      return om.readValue(json, Insights.class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt insights column: " + e.getOriginalMessage(), e);
    }
  }

  public static List<String> codes(List<AnalyzerKind> kinds) {
    if (kinds == null || kinds.isEmpty()) return null;
    List<String> out = new ArrayList<>(kinds.size());
    for (AnalyzerKind k : kinds) {
      out.add(k.code());
    }
    return out;
  }

  private static List<AnalyzerKind> kinds(List<String> codes) {
    if (codes == null || codes.isEmpty()) return null;
    List<AnalyzerKind> out = new ArrayList<>(codes.size());
    for (String c : codes) {
      out.add(AnalyzerKind.valueOf(c.toUpperCase(Locale.ROOT)));
    }
    return out;
  }
}
