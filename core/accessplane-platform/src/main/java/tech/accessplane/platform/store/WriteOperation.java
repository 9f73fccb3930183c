package tech.accessplane.platform.store;

import java.util.Objects;

/**
 * A single item write inside {@link KeyValueStore#transactWrite} or
 * {@link KeyValueStore#batchWrite}.
 */
public sealed interface WriteOperation permits WriteOperation.Put, WriteOperation.Delete {

    ItemKey key();

    /**
     * Put an item. With {@code requireAbsent} the write only applies when no
     * item with the same key exists; in a transaction a failed precondition
     * cancels every operation.
     */
    record Put(Item item, boolean requireAbsent) implements WriteOperation {
        public Put {
            Objects.requireNonNull(item, "item");
        }

        @Override
        public ItemKey key() {
            return item.key();
        }
    }

    record Delete(ItemKey key) implements WriteOperation {
        public Delete {
            Objects.requireNonNull(key, "key");
        }
    }

    static WriteOperation put(Item item) {
        return new Put(item, false);
    }

    static WriteOperation putIfAbsent(Item item) {
        return new Put(item, true);
    }

    static WriteOperation delete(ItemKey key) {
        return new Delete(key);
    }
}
