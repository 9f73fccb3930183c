package tech.accessplane.platform.store;

import java.util.Objects;

/**
 * Composite primary key of an item: partition component plus sort component.
 */
public record ItemKey(String partitionKey, String sortKey) {

    public ItemKey {
        Objects.requireNonNull(partitionKey, "partitionKey");
        Objects.requireNonNull(sortKey, "sortKey");
    }

    @Override
    public String toString() {
        return partitionKey + " / " + sortKey;
    }
}
