package tech.accessplane.platform.principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.common.SideEffectOutcome;
import tech.accessplane.platform.identity.IdentityProviderAdapter;
import tech.accessplane.platform.identity.ProvisionResult;
import tech.accessplane.platform.identity.UserProfile;
import tech.accessplane.platform.notification.NotificationContext;
import tech.accessplane.platform.notification.NotificationDispatcher;
import tech.accessplane.platform.notification.Recipient;

/**
 * Best-effort side effects of provisioning a principal: the identity
 * provider call and the credential email.
 *
 * <p>Nothing here throws. Failures are logged and returned as
 * {@link SideEffectOutcome.Failed} so the caller decides what to surface.
 */
@ApplicationScoped
public class IdentityProvisioningService {

    private static final Logger LOG = Logger.getLogger(IdentityProvisioningService.class);

    @Inject
    IdentityProviderAdapter identityProvider;

    @Inject
    NotificationDispatcher notificationDispatcher;

    /**
     * Outcome of a provisioning attempt. {@code result} is null when the
     * provider call failed.
     */
    public record Attempt(ProvisionResult result, SideEffectOutcome outcome) {

        public String externalSubjectId() {
            return result != null ? result.externalSubjectId() : null;
        }

        public boolean issuedTemporaryPassword() {
            return result != null && result.created() && result.hasTemporaryPassword();
        }
    }

    /**
     * Identity provider profile of a stored principal.
     */
    public static UserProfile profileOf(Principal principal) {
        return UserProfile.builder(principal.email)
            .firstName(principal.firstName)
            .lastName(principal.lastName)
            .tenantId(principal.tenantId)
            .enterpriseId(principal.enterpriseId)
            .role(principal.assignedRole)
            .groupName(principal.assignedGroup)
            .build();
    }

    public Attempt provision(UserProfile profile) {
        try {
            ProvisionResult result = identityProvider.createUser(profile);
            return new Attempt(result, result.toOutcome());
        } catch (RuntimeException e) {
            LOG.errorf("Identity provider provisioning failed for %s: %s. Proceeding with the stored record.",
                profile.email(), e.getMessage());
            return new Attempt(null, SideEffectOutcome.failed(e));
        }
    }

    /**
     * Send the credential email for a principal just created upstream.
     * Returns {@code Skipped} when no temporary password was issued.
     */
    public SideEffectOutcome notifyCredentials(Attempt attempt, Recipient recipient, NotificationContext context) {
        if (!attempt.issuedTemporaryPassword()) {
            return SideEffectOutcome.skipped("No temporary password issued");
        }
        try {
            return notificationDispatcher
                .sendCredentialProvisionedEmail(recipient, attempt.result().temporaryPassword(), context)
                .toOutcome();
        } catch (RuntimeException e) {
            LOG.errorf("Credential notification failed for %s: %s", recipient.email(), e.getMessage());
            return SideEffectOutcome.failed(e);
        }
    }
}
