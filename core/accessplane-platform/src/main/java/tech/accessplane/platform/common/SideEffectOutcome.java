package tech.accessplane.platform.common;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Outcome of a best-effort call to an external system (identity provider,
 * notification dispatcher).
 *
 * <p>These calls never fail the enclosing operation. Their outcome is returned
 * to the caller so it can be logged or shown, instead of being swallowed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "outcome")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SideEffectOutcome.Created.class, name = "CREATED"),
    @JsonSubTypes.Type(value = SideEffectOutcome.Updated.class, name = "UPDATED"),
    @JsonSubTypes.Type(value = SideEffectOutcome.Deleted.class, name = "DELETED"),
    @JsonSubTypes.Type(value = SideEffectOutcome.Sent.class, name = "SENT"),
    @JsonSubTypes.Type(value = SideEffectOutcome.Skipped.class, name = "SKIPPED"),
    @JsonSubTypes.Type(value = SideEffectOutcome.Failed.class, name = "FAILED")
})
public sealed interface SideEffectOutcome {

    /** A new external record was created; {@code reference} is its id. */
    record Created(String reference) implements SideEffectOutcome {}

    /** An existing external record was updated. */
    record Updated(String reference) implements SideEffectOutcome {}

    record Deleted(String reference) implements SideEffectOutcome {}

    /** A message was handed to the delivery service. */
    record Sent(String reference) implements SideEffectOutcome {}

    /** Nothing was attempted (not configured, disabled, nothing to do). */
    record Skipped(String reason) implements SideEffectOutcome {}

    record Failed(String reason) implements SideEffectOutcome {}

    static SideEffectOutcome skipped(String reason) {
        return new Skipped(reason);
    }

    static SideEffectOutcome failed(Throwable error) {
        String message = error.getMessage();
        return new Failed(message != null ? message : error.getClass().getSimpleName());
    }

    default boolean isFailure() {
        return this instanceof Failed;
    }
}
