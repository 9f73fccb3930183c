package tech.accessplane.platform.identity;

import tech.accessplane.platform.common.SideEffectOutcome;

/**
 * Result of {@link IdentityProviderAdapter#createUser}.
 *
 * <p>Exactly one of {@code created}, {@code updated}, {@code skipped} is true.
 * {@code temporaryPassword} is only set for newly created principals.
 */
public record ProvisionResult(
    boolean created,
    boolean updated,
    boolean skipped,
    String externalSubjectId,
    String temporaryPassword,
    String reason
) {

    public static ProvisionResult created(String externalSubjectId, String temporaryPassword) {
        return new ProvisionResult(true, false, false, externalSubjectId, temporaryPassword, null);
    }

    public static ProvisionResult updated(String externalSubjectId) {
        return new ProvisionResult(false, true, false, externalSubjectId, null, null);
    }

    public static ProvisionResult skipped(String reason) {
        return new ProvisionResult(false, false, true, null, null, reason);
    }

    public boolean hasTemporaryPassword() {
        return temporaryPassword != null && !temporaryPassword.isEmpty();
    }

    public SideEffectOutcome toOutcome() {
        if (skipped) {
            return new SideEffectOutcome.Skipped(reason);
        }
        return created
            ? new SideEffectOutcome.Created(externalSubjectId)
            : new SideEffectOutcome.Updated(externalSubjectId);
    }
}
