package tech.accessplane.platform.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for use case failures.
 *
 * Errors are categorized by type so the HTTP layer can map them to a status
 * code without inspecting messages.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Input validation failed (missing required fields, invalid format, etc.)
     * Maps to HTTP 400 Bad Request.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Principal, role or other entity not found.
     * Maps to HTTP 404 Not Found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Tenant is at or over its licensed user ceiling. Nothing was written.
     * Maps to HTTP 403 Forbidden.
     */
    record CapacityExceeded(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * A required external integration has no usable configuration.
     * Maps to HTTP 400 Bad Request.
     */
    record NotConfigured(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * The authoritative write to the key-value store failed. For transactional
     * writes no partial state exists afterwards.
     * Maps to HTTP 500 / 409 depending on {@code code}.
     */
    record StoreFailure(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}
}
