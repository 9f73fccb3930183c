package tech.accessplane.platform.store;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Configuration for the key-value store.
 */
@ConfigMapping(prefix = "accessplane.store")
public interface StoreConfig {

    /**
     * Store backend type: DYNAMODB or MEMORY.
     */
    @WithDefault("DYNAMODB")
    KeyValueStore.StoreType type();

    /**
     * Table name prefix; the table is {@code <prefix>data}.
     */
    @WithDefault("app_")
    String tablePrefix();

    @WithDefault("us-east-1")
    String region();

    /**
     * Endpoint override for local DynamoDB or LocalStack.
     */
    Optional<String> endpointOverride();

    /**
     * How many times unprocessed batch items are resubmitted before the
     * batch write is reported as failed.
     */
    @WithDefault("3")
    int batchRetryLimit();

    default String tableName() {
        return tablePrefix() + "data";
    }
}
