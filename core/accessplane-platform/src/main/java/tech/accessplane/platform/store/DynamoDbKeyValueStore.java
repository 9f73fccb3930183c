package tech.accessplane.platform.store;

import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * DynamoDB implementation of the key-value store.
 *
 * <p>The table has string keys {@code PK}/{@code SK} and the global secondary
 * indexes {@code GSI1} (by type) and {@code GSI2} (by tenant). Queries follow
 * {@code LastEvaluatedKey} until the result is complete.
 *
 * <p>Note: @Typed excludes KeyValueStore from bean types so only the
 * KeyValueStoreProducer can provide the KeyValueStore interface.
 */
@Singleton
@Typed(DynamoDbKeyValueStore.class)
public class DynamoDbKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(DynamoDbKeyValueStore.class);

    private static final String ATTRIBUTE_NOT_EXISTS_PK = "attribute_not_exists(#pk)";

    @Inject
    DynamoDbClient dynamoDb;

    @Inject
    StoreConfig config;

    @Override
    public Optional<Item> get(ItemKey key) {
        try {
            GetItemResponse response = dynamoDb.getItem(GetItemRequest.builder()
                .tableName(tableName())
                .key(AttributeValues.keyOf(key))
                .build());
            if (!response.hasItem() || response.item().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(AttributeValues.toItem(response.item()));
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to get " + key, e);
        }
    }

    @Override
    public List<Item> query(KeyCondition condition) {
        return runQuery(null, KeySpace.PK, KeySpace.SK, condition);
    }

    @Override
    public List<Item> queryByIndex(StoreIndex index, KeyCondition condition) {
        return runQuery(index.indexName(), index.partitionAttribute(), index.sortAttribute(), condition);
    }

    private List<Item> runQuery(String indexName, String partitionAttribute, String sortAttribute,
                                KeyCondition condition) {
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();
        names.put("#pk", partitionAttribute);
        values.put(":pk", AttributeValue.fromS(condition.partitionKey()));

        String expression = "#pk = :pk";
        if (condition.sortKeyEquals() != null) {
            names.put("#sk", sortAttribute);
            values.put(":sk", AttributeValue.fromS(condition.sortKeyEquals()));
            expression += " AND #sk = :sk";
        } else if (condition.sortKeyPrefix() != null) {
            names.put("#sk", sortAttribute);
            values.put(":sk", AttributeValue.fromS(condition.sortKeyPrefix()));
            expression += " AND begins_with(#sk, :sk)";
        }

        List<Item> items = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        try {
            do {
                QueryRequest.Builder request = QueryRequest.builder()
                    .tableName(tableName())
                    .keyConditionExpression(expression)
                    .expressionAttributeNames(names)
                    .expressionAttributeValues(values);
                if (indexName != null) {
                    request.indexName(indexName);
                }
                if (startKey != null) {
                    request.exclusiveStartKey(startKey);
                }
                QueryResponse response = dynamoDb.query(request.build());
                if (response.hasItems()) {
                    response.items().forEach(item -> items.add(AttributeValues.toItem(item)));
                }
                startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                    ? response.lastEvaluatedKey()
                    : null;
            } while (startKey != null);
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to query " + (indexName != null ? indexName : "table")
                + " for " + condition.partitionKey(), e);
        }
        return items;
    }

    @Override
    public void put(Item item) {
        try {
            dynamoDb.putItem(PutItemRequest.builder()
                .tableName(tableName())
                .item(AttributeValues.toAttributeMap(item))
                .build());
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to put " + item.key(), e);
        }
    }

    @Override
    public Item update(ItemKey key, Map<String, ?> fields) {
        if (fields.containsKey(KeySpace.PK) || fields.containsKey(KeySpace.SK)) {
            throw new IllegalArgumentException("Key attributes cannot be updated");
        }

        Map<String, String> names = new LinkedHashMap<>();
        Map<String, AttributeValue> values = new LinkedHashMap<>();
        StringJoiner assignments = new StringJoiner(", ", "SET ", "");
        int i = 0;
        for (Map.Entry<String, ?> field : fields.entrySet()) {
            if (field.getValue() == null) {
                continue;
            }
            names.put("#f" + i, field.getKey());
            values.put(":v" + i, AttributeValues.toAttributeValue(field.getValue()));
            assignments.add("#f" + i + " = :v" + i);
            i++;
        }
        if (names.isEmpty()) {
            return get(key).orElseGet(() -> Item.builder().key(key).build());
        }

        try {
            UpdateItemResponse response = dynamoDb.updateItem(UpdateItemRequest.builder()
                .tableName(tableName())
                .key(AttributeValues.keyOf(key))
                .updateExpression(assignments.toString())
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .returnValues(ReturnValue.ALL_NEW)
                .build());
            return AttributeValues.toItem(response.attributes());
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to update " + key, e);
        }
    }

    @Override
    public void delete(ItemKey key) {
        try {
            dynamoDb.deleteItem(DeleteItemRequest.builder()
                .tableName(tableName())
                .key(AttributeValues.keyOf(key))
                .build());
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to delete " + key, e);
        }
    }

    @Override
    public void transactWrite(List<WriteOperation> operations) {
        if (operations.isEmpty()) {
            return;
        }
        if (operations.size() > MAX_TRANSACTION_SIZE) {
            throw new IllegalArgumentException(
                "Transaction has " + operations.size() + " operations, limit is " + MAX_TRANSACTION_SIZE);
        }

        List<TransactWriteItem> items = new ArrayList<>(operations.size());
        for (WriteOperation op : operations) {
            items.add(toTransactItem(op));
        }

        try {
            dynamoDb.transactWriteItems(TransactWriteItemsRequest.builder()
                .transactItems(items)
                .build());
            LOG.debugf("Committed transaction of %d operations", operations.size());
        } catch (TransactionCanceledException e) {
            List<String> reasons = e.hasCancellationReasons()
                ? e.cancellationReasons().stream().map(CancellationReason::code).toList()
                : List.of();
            throw new TransactionCancelledException("Transaction cancelled", reasons, e);
        } catch (DynamoDbException e) {
            throw new StoreException("Transaction of " + operations.size() + " operations failed", e);
        }
    }

    private TransactWriteItem toTransactItem(WriteOperation op) {
        if (op instanceof WriteOperation.Put put) {
            return TransactWriteItem.builder()
                .put(p -> {
                    p.tableName(tableName()).item(AttributeValues.toAttributeMap(put.item()));
                    if (put.requireAbsent()) {
                        p.conditionExpression(ATTRIBUTE_NOT_EXISTS_PK)
                            .expressionAttributeNames(Map.of("#pk", KeySpace.PK));
                    }
                })
                .build();
        }
        return TransactWriteItem.builder()
            .delete(d -> d.tableName(tableName()).key(AttributeValues.keyOf(op.key())))
            .build();
    }

    @Override
    public int batchWrite(List<WriteOperation> operations) {
        int applied = 0;
        for (int start = 0; start < operations.size(); start += MAX_BATCH_SIZE) {
            List<WriteOperation> chunk = operations.subList(start, Math.min(start + MAX_BATCH_SIZE, operations.size()));
            List<WriteRequest> requests = new ArrayList<>(chunk.size());
            for (WriteOperation op : chunk) {
                requests.add(toWriteRequest(op, applied));
            }
            try {
                writeChunk(requests, applied);
            } catch (DynamoDbException e) {
                throw new BatchWriteException("Batch write failed after " + applied + " operations", applied, e);
            }
            applied += chunk.size();
        }
        return applied;
    }

    private void writeChunk(List<WriteRequest> requests, int appliedSoFar) {
        Map<String, List<WriteRequest>> pending = Map.of(tableName(), requests);
        int attempts = 0;
        while (true) {
            BatchWriteItemResponse response = dynamoDb.batchWriteItem(BatchWriteItemRequest.builder()
                .requestItems(pending)
                .build());
            if (!response.hasUnprocessedItems() || response.unprocessedItems().isEmpty()) {
                return;
            }
            pending = response.unprocessedItems();
            int unprocessed = pending.values().stream().mapToInt(List::size).sum();
            if (attempts++ >= config.batchRetryLimit()) {
                throw new BatchWriteException(
                    unprocessed + " items left unprocessed after " + attempts + " attempts", appliedSoFar);
            }
            LOG.warnf("Resubmitting %d unprocessed batch items (attempt %d)", unprocessed, attempts);
        }
    }

    private WriteRequest toWriteRequest(WriteOperation op, int appliedSoFar) {
        if (op instanceof WriteOperation.Put put) {
            if (put.requireAbsent()) {
                throw new BatchWriteException("Conditional puts are not supported in batch writes", appliedSoFar);
            }
            return WriteRequest.builder()
                .putRequest(PutRequest.builder().item(AttributeValues.toAttributeMap(put.item())).build())
                .build();
        }
        return WriteRequest.builder()
            .deleteRequest(DeleteRequest.builder().key(AttributeValues.keyOf(op.key())).build())
            .build();
    }

    private String tableName() {
        return config.tableName();
    }
}
