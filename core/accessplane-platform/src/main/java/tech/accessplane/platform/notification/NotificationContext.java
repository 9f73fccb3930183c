package tech.accessplane.platform.notification;

/**
 * Display and audit context of a notification: which tenant and principal it
 * concerns. Every field is optional.
 */
public record NotificationContext(String tenantId, String tenantName, String principalId) {
}
