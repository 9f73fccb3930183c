package tech.accessplane.platform.sync;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReconciliationStatus {
    /** Created at the identity provider. */
    PROVISIONED,
    /** Already existed at the identity provider; its attributes were updated. */
    UPDATED,
    SKIPPED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
