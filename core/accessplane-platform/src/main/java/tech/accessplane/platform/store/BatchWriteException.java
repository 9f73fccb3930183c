package tech.accessplane.platform.store;

/**
 * A chunked batch write stopped part way. Chunks before the failing one stay
 * applied; {@link #appliedOperations()} says how many operations that was.
 * Batch writes are only used for idempotent puts and deletes, so the caller
 * recovers by re-running the same operation.
 */
public class BatchWriteException extends StoreException {

    private final int appliedOperations;

    public BatchWriteException(String message, int appliedOperations, Throwable cause) {
        super(message, cause);
        this.appliedOperations = appliedOperations;
    }

    public BatchWriteException(String message, int appliedOperations) {
        super(message);
        this.appliedOperations = appliedOperations;
    }

    public int appliedOperations() {
        return appliedOperations;
    }
}
