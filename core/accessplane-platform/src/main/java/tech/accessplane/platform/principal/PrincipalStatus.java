package tech.accessplane.platform.principal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stored status of a principal. Stored lower case.
 */
public enum PrincipalStatus {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    PrincipalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @return the status, or null for an absent or unknown value
     */
    @JsonCreator
    public static PrincipalStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (PrincipalStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
