package tech.accessplane.platform.store;

import java.util.List;

/**
 * A transactional write was rejected as a whole, either because a
 * precondition failed or because the store cancelled it. None of its
 * operations were applied.
 */
public class TransactionCancelledException extends StoreException {

    private final List<String> reasons;

    public TransactionCancelledException(String message, List<String> reasons) {
        super(message + " " + reasons);
        this.reasons = List.copyOf(reasons);
    }

    public TransactionCancelledException(String message, List<String> reasons, Throwable cause) {
        super(message + " " + reasons, cause);
        this.reasons = List.copyOf(reasons);
    }

    public List<String> reasons() {
        return reasons;
    }
}
