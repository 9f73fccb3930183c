package tech.accessplane.platform.principal.mapper;

import tech.accessplane.platform.principal.Principal;
import tech.accessplane.platform.principal.PrincipalStatus;
import tech.accessplane.platform.store.Item;
import tech.accessplane.platform.store.KeySpace;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Mapper for converting between the Principal domain model and store items.
 *
 * <p>Attribute names are shared with existing data; the tenant is stored as
 * {@code accountId} and the identity-provider subject as {@code cognitoSub}.
 */
public final class PrincipalItemMapper {

    public static final String ATTR_ID = "id";
    public static final String ATTR_TENANT_ID = "accountId";
    public static final String ATTR_ENTERPRISE_ID = "enterpriseId";
    public static final String ATTR_FIRST_NAME = "firstName";
    public static final String ATTR_MIDDLE_NAME = "middleName";
    public static final String ATTR_LAST_NAME = "lastName";
    public static final String ATTR_EMAIL = "email";
    public static final String ATTR_ASSIGNED_ROLE = "assignedRole";
    public static final String ATTR_ASSIGNED_GROUP = "assignedGroup";
    public static final String ATTR_START_DATE = "startDate";
    public static final String ATTR_END_DATE = "endDate";
    public static final String ATTR_STATUS = "status";
    public static final String ATTR_TECHNICAL_USER = "isTechnicalUser";
    public static final String ATTR_EXTERNAL_SUBJECT_ID = "cognitoSub";
    public static final String ATTR_CREATED_AT = "createdAt";
    public static final String ATTR_UPDATED_AT = "updatedAt";

    public static final String ATTR_USER_ID = "userId";
    public static final String ATTR_WORKSTREAM_ID = "workstreamId";

    private PrincipalItemMapper() {
    }

    /**
     * Convert a metadata item to the domain model.
     */
    public static Principal toDomain(Item item) {
        if (item == null) {
            return null;
        }

        Principal principal = new Principal();
        principal.id = item.getString(ATTR_ID);
        if (principal.id == null) {
            principal.id = item.getString(KeySpace.PK).substring(KeySpace.USER_PREFIX.length());
        }
        principal.tenantId = item.getString(ATTR_TENANT_ID);
        principal.enterpriseId = item.getString(ATTR_ENTERPRISE_ID);
        principal.firstName = item.getString(ATTR_FIRST_NAME);
        principal.middleName = item.getString(ATTR_MIDDLE_NAME);
        principal.lastName = item.getString(ATTR_LAST_NAME);
        principal.email = item.getString(ATTR_EMAIL);
        principal.assignedRole = item.getString(ATTR_ASSIGNED_ROLE);
        principal.assignedGroup = item.getString(ATTR_ASSIGNED_GROUP);
        principal.startDate = item.getString(ATTR_START_DATE);
        principal.endDate = item.getString(ATTR_END_DATE);
        principal.status = PrincipalStatus.fromValue(item.getString(ATTR_STATUS));
        principal.technicalUser = item.getBoolean(ATTR_TECHNICAL_USER, false);
        principal.externalSubjectId = item.findString(ATTR_EXTERNAL_SUBJECT_ID).orElse(null);
        principal.createdAt = parseInstant(item.getString(ATTR_CREATED_AT));
        principal.updatedAt = parseInstant(item.getString(ATTR_UPDATED_AT));
        return principal;
    }

    /**
     * Convert the domain model to its metadata item, including the index keys.
     */
    public static Item toItem(Principal principal) {
        return Item.builder()
            .key(KeySpace.userMetadata(principal.id))
            .set(KeySpace.GSI1_PK, KeySpace.ENTITY_USER)
            .set(KeySpace.GSI1_SK, KeySpace.user(principal.id))
            .set(KeySpace.GSI2_PK, KeySpace.accountUsers(principal.tenantId))
            .set(KeySpace.GSI2_SK, KeySpace.user(principal.id))
            .set(ATTR_ID, principal.id)
            .set(ATTR_TENANT_ID, principal.tenantId)
            .set(ATTR_ENTERPRISE_ID, principal.enterpriseId)
            .set(ATTR_FIRST_NAME, principal.firstName)
            .set(ATTR_MIDDLE_NAME, principal.middleName)
            .set(ATTR_LAST_NAME, principal.lastName)
            .set(ATTR_EMAIL, principal.email)
            .set(ATTR_ASSIGNED_ROLE, principal.assignedRole)
            .set(ATTR_ASSIGNED_GROUP, principal.assignedGroup)
            .set(ATTR_START_DATE, principal.startDate)
            .set(ATTR_END_DATE, principal.endDate)
            .set(ATTR_STATUS, principal.status != null ? principal.status.value() : null)
            .set(ATTR_TECHNICAL_USER, principal.technicalUser)
            .set(ATTR_EXTERNAL_SUBJECT_ID, principal.externalSubjectId)
            .set(ATTR_CREATED_AT, principal.createdAt != null ? principal.createdAt.toString() : null)
            .set(ATTR_UPDATED_AT, principal.updatedAt != null ? principal.updatedAt.toString() : null)
            .build();
    }

    /**
     * Workstream assignment item of a principal.
     */
    public static Item toWorkstreamItem(String principalId, String workstreamId, Instant createdAt) {
        return Item.builder()
            .set(KeySpace.PK, KeySpace.user(principalId))
            .set(KeySpace.SK, KeySpace.workstream(workstreamId))
            .set(ATTR_ID, UUID.randomUUID().toString())
            .set(ATTR_USER_ID, principalId)
            .set(ATTR_WORKSTREAM_ID, workstreamId)
            .set(ATTR_CREATED_AT, createdAt.toString())
            .build();
    }

    public static String workstreamIdOf(Item item) {
        return item.findString(ATTR_WORKSTREAM_ID)
            .orElse(item.getString(KeySpace.SK).substring(KeySpace.WORKSTREAM_PREFIX.length()));
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
