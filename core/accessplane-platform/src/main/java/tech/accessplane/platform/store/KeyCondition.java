package tech.accessplane.platform.store;

import java.util.Objects;

/**
 * Key condition for a query: an exact partition value plus an optional
 * constraint on the sort component (exact value or prefix).
 */
public record KeyCondition(String partitionKey, String sortKeyPrefix, String sortKeyEquals) {

    public KeyCondition {
        Objects.requireNonNull(partitionKey, "partitionKey");
        if (sortKeyPrefix != null && sortKeyEquals != null) {
            throw new IllegalArgumentException("Use either a sort key prefix or an exact sort key, not both");
        }
    }

    public static KeyCondition partition(String partitionKey) {
        return new KeyCondition(partitionKey, null, null);
    }

    public static KeyCondition beginsWith(String partitionKey, String sortKeyPrefix) {
        return new KeyCondition(partitionKey, sortKeyPrefix, null);
    }

    public static KeyCondition equalTo(String partitionKey, String sortKey) {
        return new KeyCondition(partitionKey, null, sortKey);
    }

    /**
     * Whether a sort value satisfies the sort constraint of this condition.
     */
    public boolean matchesSort(String sortValue) {
        if (sortKeyEquals != null) {
            return sortKeyEquals.equals(sortValue);
        }
        if (sortKeyPrefix != null) {
            return sortValue != null && sortValue.startsWith(sortKeyPrefix);
        }
        return true;
    }
}
