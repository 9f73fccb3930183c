package tech.accessplane.platform.identity;

import tech.accessplane.platform.common.SideEffectOutcome;

/**
 * Result of {@link IdentityProviderAdapter#deleteUser}.
 */
public record DeprovisionResult(boolean deleted, boolean skipped, String reason) {

    public static DeprovisionResult removed() {
        return new DeprovisionResult(true, false, null);
    }

    public static DeprovisionResult skipped(String reason) {
        return new DeprovisionResult(false, true, reason);
    }

    public SideEffectOutcome toOutcome(String email) {
        return deleted ? new SideEffectOutcome.Deleted(email) : new SideEffectOutcome.Skipped(reason);
    }
}
