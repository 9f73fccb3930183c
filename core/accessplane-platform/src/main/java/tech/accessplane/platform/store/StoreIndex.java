package tech.accessplane.platform.store;

/**
 * Secondary indexes of the application table.
 */
public enum StoreIndex {

    /** Type-scoped listing, e.g. every {@code ENTITY#USER}. */
    BY_TYPE("GSI1", KeySpace.GSI1_PK, KeySpace.GSI1_SK),

    /** Tenant-scoped listing, e.g. {@code ACCOUNT#<id>#USERS}. */
    BY_TENANT("GSI2", KeySpace.GSI2_PK, KeySpace.GSI2_SK);

    private final String indexName;
    private final String partitionAttribute;
    private final String sortAttribute;

    StoreIndex(String indexName, String partitionAttribute, String sortAttribute) {
        this.indexName = indexName;
        this.partitionAttribute = partitionAttribute;
        this.sortAttribute = sortAttribute;
    }

    public String indexName() {
        return indexName;
    }

    public String partitionAttribute() {
        return partitionAttribute;
    }

    public String sortAttribute() {
        return sortAttribute;
    }
}
