package tech.accessplane.platform.notification;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SendEmailResponse;

/**
 * Sends credential emails through Amazon SES.
 *
 * <p>Feature-flagged by {@code accessplane.notification.credential-enabled}.
 * Every attempt, including skipped and failed ones, leaves an audit record.
 */
@ApplicationScoped
public class SesNotificationDispatcher implements NotificationDispatcher {

    private static final Logger LOG = Logger.getLogger(SesNotificationDispatcher.class);

    static final String DISABLED_REASON = "Notifications disabled";

    @Inject
    SesClient ses;

    @Inject
    NotificationConfig config;

    @Inject
    NotificationAuditRepository auditRepo;

    @Override
    public NotificationResult sendCredentialProvisionedEmail(Recipient recipient, String temporaryPassword,
                                                             NotificationContext context) {
        if (!config.credentialEnabled()) {
            LOG.debugf("Credential notification skipped for %s (disabled)", recipient.email());
            String auditId = auditRepo.record(recipient, context, "skipped", null, DISABLED_REASON);
            return NotificationResult.skipped(DISABLED_REASON, auditId);
        }

        try {
            SendEmailResponse response = ses.sendEmail(SendEmailRequest.builder()
                .source(config.senderEmail())
                .destination(Destination.builder().toAddresses(recipient.email()).build())
                .message(Message.builder()
                    .subject(content("Your " + config.platformName() + " account is ready"))
                    .body(Body.builder().text(content(textBody(recipient, temporaryPassword, context))).build())
                    .build())
                .build());

            LOG.infof("Credential email sent to %s (messageId: %s)", recipient.email(), response.messageId());
            String auditId = auditRepo.record(recipient, context, "sent", response.messageId(), null);
            return NotificationResult.sent(response.messageId(), auditId);
        } catch (SdkException e) {
            LOG.errorf("Credential email failed for %s: %s", recipient.email(), e.getMessage());
            String auditId = auditRepo.record(recipient, context, "failed", null, e.getMessage());
            return NotificationResult.failed(e.getMessage(), auditId);
        }
    }

    String textBody(Recipient recipient, String temporaryPassword, NotificationContext context) {
        StringBuilder body = new StringBuilder();
        body.append("Hello ").append(recipient.displayName()).append(",\n\n");
        body.append("An account has been created for you on ").append(config.platformName());
        if (context != null && context.tenantName() != null) {
            body.append(" for ").append(context.tenantName());
        }
        body.append(".\n\n");
        body.append("Username: ").append(recipient.email()).append('\n');
        body.append("Password: ").append(temporaryPassword).append("\n\n");
        body.append("Sign in at ").append(config.loginUrl()).append(" and change your password.\n\n");
        body.append("Questions? Contact ").append(config.supportEmail()).append('\n');
        return body.toString();
    }

    private static Content content(String data) {
        return Content.builder().data(data).charset("UTF-8").build();
    }
}
