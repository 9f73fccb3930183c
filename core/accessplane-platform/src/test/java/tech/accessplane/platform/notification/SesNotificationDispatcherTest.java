package tech.accessplane.platform.notification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.MessageRejectedException;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SendEmailResponse;
import tech.accessplane.platform.common.SideEffectOutcome;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SesNotificationDispatcher.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SesNotificationDispatcherTest {

    @Mock
    private SesClient ses;

    @Mock
    private NotificationConfig config;

    @Mock
    private NotificationAuditRepository auditRepo;

    @InjectMocks
    private SesNotificationDispatcher dispatcher;

    private final Recipient recipient = new Recipient("ada@acme.com", "Ada", "Lovelace");
    private final NotificationContext context = new NotificationContext("t1", "Acme", "p1");

    @Test
    @DisplayName("sendCredentialProvisionedEmail should skip and audit when disabled")
    void send_shouldSkip_whenDisabled() {
        // Arrange
        when(config.credentialEnabled()).thenReturn(false);
        when(auditRepo.record(eq(recipient), eq(context), eq("skipped"), isNull(), any())).thenReturn("audit-1");

        // Act
        NotificationResult result = dispatcher.sendCredentialProvisionedEmail(recipient, "Pw1!abcdEFGH", context);

        // Assert
        assertThat(result.skipped()).isTrue();
        assertThat(result.auditId()).isEqualTo("audit-1");
        assertThat(result.toOutcome()).isInstanceOf(SideEffectOutcome.Skipped.class);
        verifyNoInteractions(ses);
    }

    @Test
    @DisplayName("sendCredentialProvisionedEmail should send the credentials and audit the message id")
    void send_shouldSendAndAudit_whenEnabled() {
        // Arrange
        enable();
        when(ses.sendEmail(any(SendEmailRequest.class)))
            .thenReturn(SendEmailResponse.builder().messageId("msg-1").build());
        when(auditRepo.record(recipient, context, "sent", "msg-1", null)).thenReturn("audit-2");

        // Act
        NotificationResult result = dispatcher.sendCredentialProvisionedEmail(recipient, "Pw1!abcdEFGH", context);

        // Assert
        assertThat(result.sent()).isTrue();
        assertThat(result.messageId()).isEqualTo("msg-1");
        assertThat(result.auditId()).isEqualTo("audit-2");

        ArgumentCaptor<SendEmailRequest> captor = ArgumentCaptor.forClass(SendEmailRequest.class);
        verify(ses).sendEmail(captor.capture());
        SendEmailRequest request = captor.getValue();
        assertThat(request.source()).isEqualTo("noreply@accessplane.tech");
        assertThat(request.destination().toAddresses()).containsExactly("ada@acme.com");
        assertThat(request.message().body().text().data())
            .contains("Ada Lovelace", "Acme", "Pw1!abcdEFGH", "https://portal.test/login");
    }

    @Test
    @DisplayName("sendCredentialProvisionedEmail should report failure without throwing")
    void send_shouldReportFailure_whenSesRejects() {
        // Arrange
        enable();
        when(ses.sendEmail(any(SendEmailRequest.class)))
            .thenThrow(MessageRejectedException.builder().message("Email address is not verified").build());
        when(auditRepo.record(eq(recipient), eq(context), eq("failed"), isNull(), any())).thenReturn("audit-3");

        // Act
        NotificationResult result = dispatcher.sendCredentialProvisionedEmail(recipient, "Pw1!abcdEFGH", context);

        // Assert
        assertThat(result.sent()).isFalse();
        assertThat(result.skipped()).isFalse();
        assertThat(result.reason()).contains("not verified");
        assertThat(result.toOutcome()).isInstanceOf(SideEffectOutcome.Failed.class);
    }

    private void enable() {
        when(config.credentialEnabled()).thenReturn(true);
        when(config.senderEmail()).thenReturn("noreply@accessplane.tech");
        when(config.platformName()).thenReturn("License Portal");
        when(config.loginUrl()).thenReturn("https://portal.test/login");
        when(config.supportEmail()).thenReturn("support@accessplane.tech");
    }
}
