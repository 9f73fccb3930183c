package tech.accessplane.platform.common;

import tech.accessplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Context for a use case execution.
 *
 * <p>Carries tracing IDs and caller information through the execution
 * of a use case. The IDs are included in every log line the use case writes,
 * so a single request can be followed across the store, the identity provider
 * and the notification dispatcher.
 *
 * @param executionId   Unique ID for this execution (generated)
 * @param correlationId ID for distributed tracing (usually from original request)
 * @param principalId   ID or email of the caller performing the action
 * @param initiatedAt   When the execution was initiated
 */
public record ExecutionContext(
    String executionId,
    String correlationId,
    String principalId,
    Instant initiatedAt
) {

    /**
     * Create a new execution context for a fresh request.
     *
     * <p>The executionId and correlationId are both set to a new TSID.
     *
     * @param principalId The caller performing the action
     * @return A new execution context
     */
    public static ExecutionContext create(String principalId) {
        String execId = "exec-" + TsidGenerator.generateRaw();
        return new ExecutionContext(
            execId,
            execId,  // correlation starts as execution ID
            principalId,
            Instant.now()
        );
    }

    /**
     * Context for work not initiated by a caller (reconciliation runs, startup).
     */
    public static ExecutionContext system() {
        return create("system");
    }
}
