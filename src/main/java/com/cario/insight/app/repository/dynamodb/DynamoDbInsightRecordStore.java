package com.cario.insight.app.repository.dynamodb;

import com.cario.insight.app.model.AnalyzerKind;
import com.cario.insight.app.model.FailureReason;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.Insights;
import com.cario.insight.app.model.JobStatus;
import com.cario.insight.app.repository.InsightRecordMapper;
import com.cario.insight.app.repository.InsightRecordStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;

/**
 * Enhanced-client repository over the insight record table. Creation is guarded by {@code
 * attribute_not_exists(jobId)} and every terminal write by {@code status = processing}.
 */
@Log4j2
public class DynamoDbInsightRecordStore implements InsightRecordStore {

  private final DynamoDbClient ddb;
  private final DynamoDbTable<InsightRecordItem> table;
  private final String tableName;
  private final InsightRecordMapper mapper;
  private final Clock clock;

  public DynamoDbInsightRecordStore(
      DynamoDbClient ddb, String tableName, InsightRecordMapper mapper, Clock clock) {
    this.ddb = ddb;
    this.tableName = tableName;
    this.mapper = mapper;
    this.clock = clock;
    DynamoDbEnhancedClient enhanced = DynamoDbEnhancedClient.builder().dynamoDbClient(ddb).build();
    this.table = enhanced.table(tableName, TableSchema.fromBean(InsightRecordItem.class));
  }

  @Override
  public boolean createIfAbsent(InsightRecord record) {
    InsightRecordItem item = mapper.toItem(record);
    Expression absent =
        Expression.builder()
            .expression("attribute_not_exists(#id)")
            .putExpressionName("#id", "jobId")
            .build();
    try {
      table.putItem(
          PutItemEnhancedRequest.builder(InsightRecordItem.class)
              .item(item)
              .conditionExpression(absent)
              .build());
      log.info("insightstore.create jobId={}", item.getJobId());
      return true;
    } catch (ConditionalCheckFailedException e) {
      log.debug("insightstore.create exists jobId={}", item.getJobId());
      return false;
    }
  }

  @Override
  public Optional<InsightRecord> find(String jobId) {
    if (jobId == null) return Optional.empty();
    InsightRecordItem item = get(jobId);
    return item == null ? Optional.empty() : Optional.of(mapper.toRecord(item));
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
        item ->
            item.toBuilder()
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
        item ->
            item.toBuilder()
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
    Expression filter =
        Expression.builder()
            .expression("#s = :processing AND #c < :cutoff")
            .putExpressionName("#s", "status")
            .putExpressionName("#c", "createdAt")
            .putExpressionValue(":processing", str(JobStatus.PROCESSING.code()))
            .putExpressionValue(":cutoff", str(cutoff.toString()))
            .build();
    return table.scan(ScanEnhancedRequest.builder().filterExpression(filter).build()).items()
        .stream()
        .map(mapper::toRecord)
        .collect(Collectors.toList());
  }

  @Override
  public boolean isAvailable() {
    try {
      ddb.describeTable(DescribeTableRequest.builder().tableName(tableName).build());
      return true;
    } catch (RuntimeException e) {
      log.warn("insightstore.health table={} msg={}", tableName, e.getMessage());
      return false;
    }
  }

  // -------- Internals --------

  private InsightRecordItem get(String jobId) {
    return table.getItem(Key.builder().partitionValue(jobId).build());
  }

  private boolean transition(String jobId, UnaryOperator<InsightRecordItem> update) {
    InsightRecordItem current = get(jobId);
    if (current == null || !JobStatus.PROCESSING.code().equals(current.getStatus())) {
      log.warn("insightstore.transition skipped jobId={} (missing or terminal)", jobId);
      return false;
    }
    Expression stillProcessing =
        Expression.builder()
            .expression("#s = :processing")
            .putExpressionName("#s", "status")
            .putExpressionValue(":processing", str(JobStatus.PROCESSING.code()))
            .build();
    InsightRecordItem next = update.apply(current);
    try {
      table.putItem(
          PutItemEnhancedRequest.builder(InsightRecordItem.class)
              .item(next)
              .conditionExpression(stillProcessing)
              .build());
      log.info("insightstore.transition jobId={} status={}", jobId, next.getStatus());
      return true;
    } catch (ConditionalCheckFailedException e) {
      log.warn("insightstore.transition lost race jobId={}", jobId);
      return false;
    }
  }

  private static AttributeValue str(String s) {
    return AttributeValue.builder().s(s).build();
  }
}
