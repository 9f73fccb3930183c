package tech.accessplane.platform.notification;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.shared.TsidGenerator;
import tech.accessplane.platform.store.Item;
import tech.accessplane.platform.store.KeySpace;
import tech.accessplane.platform.store.KeyValueStore;
import tech.accessplane.platform.store.StoreException;

import java.time.Instant;

/**
 * Writes one audit item per notification attempt:
 * {@code NOTIFICATION#<auditId>} / {@code METADATA}, listed under
 * {@code ENTITY#NOTIFICATION_AUDIT}.
 *
 * <p>Audit writes never fail the notification; a failed write is logged and
 * the audit id is still returned.
 */
@ApplicationScoped
public class NotificationAuditRepository {

    private static final Logger LOG = Logger.getLogger(NotificationAuditRepository.class);

    static final String TYPE_CREDENTIAL_PROVISIONED = "credential_provisioned";

    @Inject
    KeyValueStore store;

    public String record(Recipient recipient, NotificationContext context, String deliveryStatus,
                         String messageId, String reason) {
        String auditId = TsidGenerator.generateRaw();
        String now = Instant.now().toString();
        Item item = Item.builder()
            .set(KeySpace.PK, KeySpace.notification(auditId))
            .set(KeySpace.SK, KeySpace.METADATA)
            .set(KeySpace.GSI1_PK, KeySpace.ENTITY_NOTIFICATION_AUDIT)
            .set(KeySpace.GSI1_SK, now + "#" + auditId)
            .set("id", auditId)
            .set("notificationType", TYPE_CREDENTIAL_PROVISIONED)
            .set("recipientEmail", recipient.email())
            .set("recipientName", recipient.displayName())
            .set("accountId", context != null ? context.tenantId() : null)
            .set("accountName", context != null ? context.tenantName() : null)
            .set("userId", context != null ? context.principalId() : null)
            .set("deliveryStatus", deliveryStatus)
            .set("messageId", messageId)
            .set("reason", reason)
            .set("createdAt", now)
            .build();
        try {
            store.put(item);
        } catch (StoreException e) {
            LOG.warnf("Failed to write notification audit %s for %s: %s", auditId, recipient.email(), e.getMessage());
        }
        return auditId;
    }
}
