package tech.accessplane.platform.store;

import jakarta.enterprise.inject.Typed;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory key-value store.
 *
 * <p>Items are held as adjacency maps, partition key to (sort key to item), so
 * a prefix query is a sub-map lookup. Secondary indexes are evaluated at query
 * time from the index attributes on each item.
 *
 * <p>Single-node only. Used for local development and as the store behind the
 * service tests.
 *
 * <p>Note: @Typed excludes KeyValueStore from bean types so only the
 * KeyValueStoreProducer can provide the KeyValueStore interface.
 */
@Singleton
@Typed(InMemoryKeyValueStore.class)
public class InMemoryKeyValueStore implements KeyValueStore {

    private final NavigableMap<String, NavigableMap<String, Item>> partitions = new TreeMap<>();

    @Override
    public synchronized Optional<Item> get(ItemKey key) {
        NavigableMap<String, Item> partition = partitions.get(key.partitionKey());
        return partition == null ? Optional.empty() : Optional.ofNullable(partition.get(key.sortKey()));
    }

    @Override
    public synchronized List<Item> query(KeyCondition condition) {
        NavigableMap<String, Item> partition = partitions.get(condition.partitionKey());
        if (partition == null) {
            return List.of();
        }
        NavigableMap<String, Item> range = partition;
        if (condition.sortKeyEquals() != null) {
            Item item = partition.get(condition.sortKeyEquals());
            return item == null ? List.of() : List.of(item);
        }
        if (condition.sortKeyPrefix() != null) {
            range = partition.tailMap(condition.sortKeyPrefix(), true);
        }
        List<Item> result = new ArrayList<>();
        for (Map.Entry<String, Item> entry : range.entrySet()) {
            if (!condition.matchesSort(entry.getKey())) {
                break;
            }
            result.add(entry.getValue());
        }
        return result;
    }

    @Override
    public synchronized List<Item> queryByIndex(StoreIndex index, KeyCondition condition) {
        List<Item> result = new ArrayList<>();
        for (NavigableMap<String, Item> partition : partitions.values()) {
            for (Item item : partition.values()) {
                if (condition.partitionKey().equals(item.getString(index.partitionAttribute()))
                    && condition.matchesSort(item.getString(index.sortAttribute()))) {
                    result.add(item);
                }
            }
        }
        result.sort(Comparator.comparing(
            (Item item) -> item.getString(index.sortAttribute()),
            Comparator.nullsFirst(Comparator.naturalOrder())));
        return result;
    }

    @Override
    public synchronized void put(Item item) {
        store(item);
    }

    @Override
    public synchronized Item update(ItemKey key, Map<String, ?> fields) {
        if (fields.containsKey(KeySpace.PK) || fields.containsKey(KeySpace.SK)) {
            throw new IllegalArgumentException("Key attributes cannot be updated");
        }
        Item current = get(key).orElseGet(() -> Item.builder().key(key).build());
        Item updated = current.with(fields);
        store(updated);
        return updated;
    }

    @Override
    public synchronized void delete(ItemKey key) {
        NavigableMap<String, Item> partition = partitions.get(key.partitionKey());
        if (partition != null) {
            partition.remove(key.sortKey());
            if (partition.isEmpty()) {
                partitions.remove(key.partitionKey());
            }
        }
    }

    @Override
    public synchronized void transactWrite(List<WriteOperation> operations) {
        if (operations.isEmpty()) {
            return;
        }
        if (operations.size() > MAX_TRANSACTION_SIZE) {
            throw new IllegalArgumentException(
                "Transaction has " + operations.size() + " operations, limit is " + MAX_TRANSACTION_SIZE);
        }

        // Check every precondition before applying anything
        List<String> reasons = new ArrayList<>();
        Set<ItemKey> seen = new HashSet<>();
        boolean cancelled = false;
        for (WriteOperation op : operations) {
            if (!seen.add(op.key())) {
                throw new IllegalArgumentException("Transaction touches " + op.key() + " more than once");
            }
            if (op instanceof WriteOperation.Put put && put.requireAbsent() && get(put.key()).isPresent()) {
                reasons.add("ConditionalCheckFailed");
                cancelled = true;
            } else {
                reasons.add("None");
            }
        }
        if (cancelled) {
            throw new TransactionCancelledException("Transaction cancelled", reasons);
        }

        for (WriteOperation op : operations) {
            apply(op);
        }
    }

    @Override
    public synchronized int batchWrite(List<WriteOperation> operations) {
        int applied = 0;
        for (int start = 0; start < operations.size(); start += MAX_BATCH_SIZE) {
            List<WriteOperation> chunk = operations.subList(start, Math.min(start + MAX_BATCH_SIZE, operations.size()));
            for (WriteOperation op : chunk) {
                if (op instanceof WriteOperation.Put put && put.requireAbsent()) {
                    throw new BatchWriteException("Conditional puts are not supported in batch writes", applied);
                }
            }
            chunk.forEach(this::apply);
            applied += chunk.size();
        }
        return applied;
    }

    /**
     * Number of items currently held.
     */
    public synchronized int size() {
        return partitions.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Remove every item.
     */
    public synchronized void clear() {
        partitions.clear();
    }

    private void apply(WriteOperation op) {
        if (op instanceof WriteOperation.Put put) {
            store(put.item());
        } else {
            delete(op.key());
        }
    }

    private void store(Item item) {
        ItemKey key = item.key();
        partitions.computeIfAbsent(key.partitionKey(), pk -> new TreeMap<>()).put(key.sortKey(), item);
    }
}
