package tech.accessplane.platform.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.accessplane.platform.common.SideEffectOutcome;

/**
 * Outcome for one principal of a reconciliation run.
 *
 * @param notification credential email outcome, only for provisioned principals
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconciliationItemResult(
    String userId,
    String email,
    ReconciliationStatus status,
    String externalSubjectId,
    String reason,
    SideEffectOutcome notification
) {

    static ReconciliationItemResult skipped(String userId, String email, String reason) {
        return new ReconciliationItemResult(userId, email, ReconciliationStatus.SKIPPED, null, reason, null);
    }

    static ReconciliationItemResult failed(String userId, String email, String reason) {
        return new ReconciliationItemResult(userId, email, ReconciliationStatus.FAILED, null, reason, null);
    }
}
