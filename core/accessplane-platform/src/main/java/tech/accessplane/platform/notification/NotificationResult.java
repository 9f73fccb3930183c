package tech.accessplane.platform.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.accessplane.platform.common.SideEffectOutcome;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationResult(
    boolean sent,
    boolean skipped,
    String reason,
    String messageId,
    String auditId
) {

    public static NotificationResult sent(String messageId, String auditId) {
        return new NotificationResult(true, false, null, messageId, auditId);
    }

    public static NotificationResult skipped(String reason, String auditId) {
        return new NotificationResult(false, true, reason, null, auditId);
    }

    public static NotificationResult failed(String reason, String auditId) {
        return new NotificationResult(false, false, reason, null, auditId);
    }

    public SideEffectOutcome toOutcome() {
        if (sent) {
            return new SideEffectOutcome.Sent(messageId);
        }
        return skipped ? new SideEffectOutcome.Skipped(reason) : new SideEffectOutcome.Failed(reason);
    }
}
