package com.cario.insight.app.repository.dynamodb;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Persisted row of an insight record. The image asset is flattened into the row; the insights
 * payload is a JSON string column.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class InsightRecordItem {

  /** Partition key: job id, also the image id. */
  private String jobId;

  /** processing | completed | failed */
  private String status;

  private String reason;
  private List<String> failedAnalyzers;
  private String insightsJson;
  private Long processingTimeMs;

  private Instant createdAt;
  private Instant updatedAt;

  // ---------- image asset ----------
  private String filename;
  private String originalKey;
  private String annotatedKey;
  private String contentType;
  private String format;
  private Long sizeBytes;
  private String checksum;
  private Integer width;
  private Integer height;
  private Instant uploadedAt;

  // ---------- DynamoDB mapping ----------

  @DynamoDbPartitionKey
  @DynamoDbAttribute("jobId")
  public String getJobId() {
    return jobId;
  }

  @DynamoDbAttribute("status")
  public String getStatus() {
    return status;
  }

  @DynamoDbAttribute("createdAt")
  public Instant getCreatedAt() {
    return createdAt;
  }

  @DynamoDbAttribute("insightsJson")
  public String getInsightsJson() {
    return insightsJson;
  }
}
