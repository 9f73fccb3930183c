package tech.accessplane.platform.store;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * CDI producer that selects the KeyValueStore implementation based on
 * configuration.
 */
@ApplicationScoped
public class KeyValueStoreProducer {

    private static final Logger LOG = Logger.getLogger(KeyValueStoreProducer.class);

    @Inject
    StoreConfig config;

    @Inject
    Instance<InMemoryKeyValueStore> inMemoryStore;

    @Inject
    Instance<DynamoDbKeyValueStore> dynamoDbStore;

    @Produces
    @ApplicationScoped
    public KeyValueStore keyValueStore() {
        KeyValueStore.StoreType type = config.type();
        LOG.infof("Initializing key-value store: type=%s", type);

        return switch (type) {
            case MEMORY -> {
                LOG.warn("Using in-memory key-value store; data is lost on restart");
                yield inMemoryStore.get();
            }
            case DYNAMODB -> {
                LOG.infof("Using DynamoDB table %s in %s", config.tableName(), config.region());
                yield dynamoDbStore.get();
            }
        };
    }
}
