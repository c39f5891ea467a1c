package com.cario.insight.app.repository.dynamodb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.insight.app.model.FailureReason;
import com.cario.insight.app.model.ImageAsset;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.model.Insights;
import com.cario.insight.app.model.JobStatus;
import com.cario.insight.app.repository.InsightRecordMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

class DynamoDbInsightRecordStoreTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private DynamoDbClient ddb;
  private DynamoDbInsightRecordStore store;

  @BeforeEach
  void setUp() {
    ddb = mock(DynamoDbClient.class);
    store =
        new DynamoDbInsightRecordStore(
            ddb, "InsightRecord", new InsightRecordMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static AttributeValue s(String v) {
    return AttributeValue.builder().s(v).build();
  }

  private void storedItem(String status) {
    when(ddb.getItem(any(GetItemRequest.class)))
        .thenReturn(
            GetItemResponse.builder()
                .item(
                    Map.of(
                        "jobId", s("job-1"),
                        "status", s(status),
                        "originalKey", s("images/a.png"),
                        "createdAt", s(NOW.minusSeconds(5).toString())))
                .build());
  }

  @Test
  void createIsConditionalOnAbsentId() {
    when(ddb.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());
    ImageAsset asset = ImageAsset.builder().id("job-1").originalKey("images/a.png").build();

    assertTrue(store.createIfAbsent(InsightRecord.processing(asset, NOW)));

    ArgumentCaptor<PutItemRequest> req = ArgumentCaptor.forClass(PutItemRequest.class);
    verify(ddb).putItem(req.capture());
    assertEquals("InsightRecord", req.getValue().tableName());
    assertEquals("attribute_not_exists(#id)", req.getValue().conditionExpression());
    assertEquals("jobId", req.getValue().expressionAttributeNames().get("#id"));
    assertEquals("processing", req.getValue().item().get("status").s());
  }

  @Test
  void duplicateCreateReturnsFalse() {
    when(ddb.putItem(any(PutItemRequest.class)))
        .thenThrow(ConditionalCheckFailedException.builder().message("exists").build());
    ImageAsset asset = ImageAsset.builder().id("job-1").originalKey("images/a.png").build();

    assertFalse(store.createIfAbsent(InsightRecord.processing(asset, NOW)));
  }

  @Test
  void findMapsStoredItem() {
    storedItem("processing");

    InsightRecord r = store.find("job-1").orElseThrow();

    assertEquals(JobStatus.PROCESSING, r.getStatus());
    assertEquals("images/a.png", r.getAsset().getOriginalKey());
    assertEquals(NOW.minusSeconds(5), r.getCreatedAt());
    assertNull(r.getInsights());
  }

  @Test
  void completedTransitionIsGuardedByProcessingStatus() {
    storedItem("processing");
    when(ddb.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

    assertTrue(
        store.markCompleted(
            "job-1", Insights.builder().brightness(10).build(), List.of(), null, 25L));

    ArgumentCaptor<PutItemRequest> req = ArgumentCaptor.forClass(PutItemRequest.class);
    verify(ddb).putItem(req.capture());
    assertEquals("#s = :processing", req.getValue().conditionExpression());
    assertEquals("completed", req.getValue().item().get("status").s());
    assertTrue(req.getValue().item().get("insightsJson").s().contains("\"brightness\":10"));
  }

  @Test
  void lostRaceReturnsFalse() {
    storedItem("processing");
    when(ddb.putItem(any(PutItemRequest.class)))
        .thenThrow(ConditionalCheckFailedException.builder().message("changed").build());

    assertFalse(store.markFailed("job-1", FailureReason.TIMEOUT, 10L));
  }

  @Test
  void terminalRecordIsNotRewritten() {
    storedItem("completed");

    assertFalse(store.markFailed("job-1", FailureReason.TIMEOUT, 10L));
    verify(ddb, never()).putItem(any(PutItemRequest.class));
  }

  @Test
  void availabilityFollowsDescribeTable() {
    when(ddb.describeTable(any(DescribeTableRequest.class)))
        .thenThrow(ResourceNotFoundException.builder().message("no table").build());

    assertFalse(store.isAvailable());
  }
}
