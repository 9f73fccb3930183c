package tech.accessplane.platform.store;

/**
 * Key-space convention for the single application table.
 *
 * <p>Every entity lives under a composite primary key ({@code PK}, {@code SK}).
 * Two global secondary indexes give reverse lookups:
 * <ul>
 *   <li>GSI1 (by type): {@code ENTITY#<TYPE>} / {@code <TYPE>#<id>}</li>
 *   <li>GSI2 (by tenant): {@code ACCOUNT#<tenantId>#USERS} / {@code USER#<id>}</li>
 * </ul>
 *
 * <p>These strings are shared with existing data and must not change.
 */
public final class KeySpace {

    public static final String PK = "PK";
    public static final String SK = "SK";
    public static final String GSI1_PK = "GSI1PK";
    public static final String GSI1_SK = "GSI1SK";
    public static final String GSI2_PK = "GSI2PK";
    public static final String GSI2_SK = "GSI2SK";

    public static final String METADATA = "METADATA";

    public static final String USER_PREFIX = "USER#";
    public static final String WORKSTREAM_PREFIX = "WORKSTREAM#";
    public static final String GROUP_PREFIX = "GROUP#";
    public static final String ROLE_PREFIX = "ROLE#";
    public static final String PERMISSION_PREFIX = "PERMISSION#";
    public static final String ACCOUNT_PREFIX = "ACCOUNT#";
    public static final String LICENSE_PREFIX = "LICENSE#";
    public static final String ENTERPRISE_PREFIX = "ENTERPRISE#";
    public static final String NOTIFICATION_PREFIX = "NOTIFICATION#";

    public static final String ENTITY_USER = "ENTITY#USER";
    public static final String ENTITY_ACCOUNT = "ENTITY#ACCOUNT";
    public static final String ENTITY_ROLE = "ENTITY#ROLE";
    public static final String ENTITY_NOTIFICATION_AUDIT = "ENTITY#NOTIFICATION_AUDIT";

    private KeySpace() {
    }

    public static String user(String principalId) {
        return USER_PREFIX + principalId;
    }

    public static String workstream(String workstreamId) {
        return WORKSTREAM_PREFIX + workstreamId;
    }

    public static String group(String groupId) {
        return GROUP_PREFIX + groupId;
    }

    public static String role(String roleId) {
        return ROLE_PREFIX + roleId;
    }

    public static String permission(String menuKey) {
        return PERMISSION_PREFIX + menuKey;
    }

    public static String account(String tenantId) {
        return ACCOUNT_PREFIX + tenantId;
    }

    public static String accountUsers(String tenantId) {
        return ACCOUNT_PREFIX + tenantId + "#USERS";
    }

    public static String enterprise(String enterpriseId) {
        return ENTERPRISE_PREFIX + enterpriseId;
    }

    public static String notification(String auditId) {
        return NOTIFICATION_PREFIX + auditId;
    }

    public static ItemKey userMetadata(String principalId) {
        return new ItemKey(user(principalId), METADATA);
    }

    public static ItemKey accountMetadata(String tenantId) {
        return new ItemKey(account(tenantId), METADATA);
    }

    public static ItemKey enterpriseMetadata(String enterpriseId) {
        return new ItemKey(enterprise(enterpriseId), METADATA);
    }

    public static ItemKey roleMetadata(String roleId) {
        return new ItemKey(role(roleId), METADATA);
    }
}
