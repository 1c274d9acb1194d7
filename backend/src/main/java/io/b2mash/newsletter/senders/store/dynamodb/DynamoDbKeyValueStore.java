package io.b2mash.newsletter.senders.store.dynamodb;

import io.b2mash.newsletter.senders.config.SenderProperties;
import io.b2mash.newsletter.senders.store.ConditionalWriteFailedException;
import io.b2mash.newsletter.senders.store.ItemKey;
import io.b2mash.newsletter.senders.store.KeyPatterns;
import io.b2mash.newsletter.senders.store.KeyValueStore;
import io.b2mash.newsletter.senders.store.StoreIndex;
import io.b2mash.newsletter.senders.store.StoreUnavailableException;
import io.b2mash.newsletter.senders.store.WriteCondition;
import io.b2mash.newsletter.senders.store.WriteRequest;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.Delete;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

/**
 * DynamoDB implementation of {@link KeyValueStore}. All AWS SDK types are confined to this package.
 */
@Component
@ConditionalOnProperty(
    name = "senders.store.provider",
    havingValue = "dynamodb",
    matchIfMissing = true)
public class DynamoDbKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(DynamoDbKeyValueStore.class);

  private static final String CONDITION_NAME = "#c0";
  private static final String CONDITION_VALUE = ":c0";
  private static final String INDEX_NAME = "#ipk";
  private static final String INDEX_VALUE = ":ipk";

  private final DynamoDbClient dynamoDb;
  private final String tableName;
  private final Map<StoreIndex, String> indexNames;

  public DynamoDbKeyValueStore(DynamoDbClient dynamoDb, SenderProperties properties) {
    this.dynamoDb = dynamoDb;
    this.tableName = properties.tableName();
    this.indexNames =
        new EnumMap<>(
            Map.of(
                StoreIndex.TENANT, properties.tenantIndexName(),
                StoreIndex.IDENTITY, properties.identityIndexName(),
                StoreIndex.PENDING_VERIFICATION, properties.pendingIndexName()));
  }

  @Override
  public Optional<Map<String, Object>> getItem(ItemKey key) {
    var request =
        GetItemRequest.builder().tableName(tableName).key(keyOf(key)).consistentRead(true).build();
    try {
      var response = dynamoDb.getItem(request);
      if (!response.hasItem() || response.item().isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(AttributeValues.fromItem(response.item()));
    } catch (SdkException e) {
      throw unavailable("getItem", key, e);
    }
  }

  @Override
  public void putItem(ItemKey key, Map<String, Object> attributes, WriteCondition condition) {
    var builder = PutItemRequest.builder().tableName(tableName).item(itemOf(key, attributes));
    var expression = ConditionExpression.of(condition);
    if (expression != null) {
      builder
          .conditionExpression(expression.expression())
          .expressionAttributeNames(expression.names())
          .expressionAttributeValues(expression.values());
    }
    try {
      dynamoDb.putItem(builder.build());
    } catch (ConditionalCheckFailedException e) {
      throw new ConditionalWriteFailedException("Condition failed for item " + key, e);
    } catch (SdkException e) {
      throw unavailable("putItem", key, e);
    }
  }

  @Override
  public List<Map<String, Object>> queryByIndex(StoreIndex index, String indexPartition) {
    String indexName = indexNames.get(index);
    var items = new ArrayList<Map<String, Object>>();
    Map<String, AttributeValue> startKey = null;
    do {
      var builder =
          QueryRequest.builder()
              .tableName(tableName)
              .indexName(indexName)
              .keyConditionExpression(INDEX_NAME + " = " + INDEX_VALUE)
              .expressionAttributeNames(Map.of(INDEX_NAME, index.partitionAttribute()))
              .expressionAttributeValues(Map.of(INDEX_VALUE, AttributeValue.fromS(indexPartition)));
      if (startKey != null) {
        builder.exclusiveStartKey(startKey);
      }
      QueryResponse response;
      try {
        response = dynamoDb.query(builder.build());
      } catch (SdkException e) {
        log.warn("DynamoDB query failed: index={}, partition={}", indexName, indexPartition);
        throw new StoreUnavailableException("Query failed on index " + indexName, e);
      }
      if (response.hasItems()) {
        for (var item : response.items()) {
          items.add(AttributeValues.fromItem(item));
        }
      }
      startKey =
          response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
              ? response.lastEvaluatedKey()
              : null;
    } while (startKey != null);
    return items;
  }

  @Override
  public void deleteItem(ItemKey key, WriteCondition condition) {
    var builder = DeleteItemRequest.builder().tableName(tableName).key(keyOf(key));
    var expression = ConditionExpression.of(condition);
    if (expression != null) {
      builder
          .conditionExpression(expression.expression())
          .expressionAttributeNames(expression.names())
          .expressionAttributeValues(expression.values());
    }
    try {
      dynamoDb.deleteItem(builder.build());
    } catch (ConditionalCheckFailedException e) {
      throw new ConditionalWriteFailedException("Condition failed for item " + key, e);
    } catch (SdkException e) {
      throw unavailable("deleteItem", key, e);
    }
  }

  @Override
  public void transactWrite(List<WriteRequest> writes) {
    var items = new ArrayList<TransactWriteItem>(writes.size());
    for (var write : writes) {
      items.add(toTransactItem(write));
    }
    try {
      dynamoDb.transactWriteItems(TransactWriteItemsRequest.builder().transactItems(items).build());
    } catch (TransactionCanceledException e) {
      if (e.hasCancellationReasons()
          && e.cancellationReasons().stream()
              .anyMatch(
                  reason ->
                      "ConditionalCheckFailed".equals(reason.code())
                          || "TransactionConflict".equals(reason.code()))) {
        throw new ConditionalWriteFailedException("Transaction condition failed", e);
      }
      throw new StoreUnavailableException("Transaction cancelled", e);
    } catch (SdkException e) {
      log.warn("DynamoDB transaction failed: items={}", writes.size());
      throw new StoreUnavailableException("Transaction failed", e);
    }
  }

  private TransactWriteItem toTransactItem(WriteRequest write) {
    var expression = ConditionExpression.of(write.condition());
    if (write instanceof WriteRequest.Put put) {
      var builder = Put.builder().tableName(tableName).item(itemOf(put.key(), put.attributes()));
      if (expression != null) {
        builder
            .conditionExpression(expression.expression())
            .expressionAttributeNames(expression.names())
            .expressionAttributeValues(expression.values());
      }
      return TransactWriteItem.builder().put(builder.build()).build();
    }
    var builder = Delete.builder().tableName(tableName).key(keyOf(write.key()));
    if (expression != null) {
      builder
          .conditionExpression(expression.expression())
          .expressionAttributeNames(expression.names())
          .expressionAttributeValues(expression.values());
    }
    return TransactWriteItem.builder().delete(builder.build()).build();
  }

  private static Map<String, AttributeValue> keyOf(ItemKey key) {
    return Map.of(
        KeyPatterns.PARTITION_KEY, AttributeValue.fromS(key.partitionKey()),
        KeyPatterns.SORT_KEY, AttributeValue.fromS(key.sortKey()));
  }

  private static Map<String, AttributeValue> itemOf(ItemKey key, Map<String, Object> attributes) {
    var item = new HashMap<>(AttributeValues.toItem(attributes));
    item.putAll(keyOf(key));
    return item;
  }

  private StoreUnavailableException unavailable(String operation, ItemKey key, SdkException e) {
    log.warn("DynamoDB {} failed: table={}, key={}", operation, tableName, key);
    return new StoreUnavailableException("DynamoDB " + operation + " failed", e);
  }

  /** Condition expression with placeholder maps, or {@code null} for unconditional writes. */
  record ConditionExpression(
      String expression, Map<String, String> names, Map<String, AttributeValue> values) {

    static ConditionExpression of(WriteCondition condition) {
      if (condition.isUnconditional()) {
        return null;
      }
      var names = new HashMap<String, String>();
      var values = new HashMap<String, AttributeValue>();
      var clauses = new ArrayList<String>();
      names.put("#pk", KeyPatterns.PARTITION_KEY);
      switch (condition.existence()) {
        case ABSENT -> clauses.add("attribute_not_exists(#pk)");
        case PRESENT -> clauses.add("attribute_exists(#pk)");
        default -> names.remove("#pk");
      }
      if (condition.attribute() != null) {
        names.put(CONDITION_NAME, condition.attribute());
        values.put(CONDITION_VALUE, AttributeValues.toAttributeValue(condition.expectedValue()));
        clauses.add(CONDITION_NAME + " = " + CONDITION_VALUE);
      }
      return new ConditionExpression(
          String.join(" AND ", clauses), names, values.isEmpty() ? null : values);
    }
  }
}
