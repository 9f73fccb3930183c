package tech.accessplane.platform.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value/query abstraction over the single application table.
 *
 * <p>One primary key ({@code PK}/{@code SK}) and two secondary indexes
 * ({@link StoreIndex}). Secondary-index reads are query-time only and may lag
 * the primary key; there are no cross-index joins. Multi-hop lookups are done
 * by the caller issuing sequential queries.
 *
 * <p>Implementations:
 * <ul>
 *   <li>DYNAMODB - {@link DynamoDbKeyValueStore} (default)</li>
 *   <li>MEMORY - {@link InMemoryKeyValueStore} (development and tests)</li>
 * </ul>
 *
 * <p>Configure via:
 * <pre>
 * accessplane.store.type=DYNAMODB|MEMORY
 * </pre>
 */
public interface KeyValueStore {

    /** Largest chunk a single batch write call sends. */
    int MAX_BATCH_SIZE = 25;

    /** Largest number of operations accepted by {@link #transactWrite}. */
    int MAX_TRANSACTION_SIZE = 100;

    /**
     * Point lookup by primary key.
     */
    Optional<Item> get(ItemKey key);

    /**
     * Query the primary key: all items of one partition, optionally narrowed
     * by sort key, in ascending sort key order.
     */
    List<Item> query(KeyCondition condition);

    /**
     * Query one of the secondary indexes, in ascending index sort key order.
     */
    List<Item> queryByIndex(StoreIndex index, KeyCondition condition);

    /**
     * Unconditional single-item put.
     */
    void put(Item item);

    /**
     * Set the given attributes on an item and return the item as it is after
     * the update. Null values are skipped, so an update never clears an
     * attribute. Key attributes cannot be updated.
     */
    Item update(ItemKey key, Map<String, ?> fields);

    /**
     * Single-item delete; deleting an absent key is not an error.
     */
    void delete(ItemKey key);

    /**
     * All-or-nothing write of up to {@link #MAX_TRANSACTION_SIZE} operations.
     *
     * @throws TransactionCancelledException if a precondition fails; nothing is applied
     * @throws StoreException for any other store failure
     */
    void transactWrite(List<WriteOperation> operations);

    /**
     * Non-transactional write of any number of unconditional puts and deletes,
     * sent sequentially in chunks of {@link #MAX_BATCH_SIZE}.
     *
     * @return number of operations applied
     * @throws BatchWriteException if a chunk fails; earlier chunks stay applied
     */
    int batchWrite(List<WriteOperation> operations);

    /**
     * Store backend type.
     */
    enum StoreType {
        MEMORY,
        DYNAMODB
    }
}
