package tech.accessplane.platform.notification;

/**
 * Sends notifications to principals.
 *
 * <p>Fire-and-forget from the caller's point of view: the outcome is reported
 * in the returned result, and callers never depend on it for correctness.
 */
public interface NotificationDispatcher {

    /**
     * Send the sign-in credentials of a newly provisioned principal.
     *
     * @param recipient         who receives the email
     * @param temporaryPassword the password issued by the identity provider
     * @param context           tenant and principal the email concerns
     * @return sent / skipped / failed, with message and audit ids where available
     */
    NotificationResult sendCredentialProvisionedEmail(Recipient recipient, String temporaryPassword,
                                                      NotificationContext context);
}
