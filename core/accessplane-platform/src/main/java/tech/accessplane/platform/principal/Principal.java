package tech.accessplane.platform.principal;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.accessplane.platform.shared.IsoDates;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A tenant's technical user: the subject of authorization and provisioning.
 *
 * <p>Stored as {@code USER#<id>} / {@code METADATA}, listed by type under
 * {@code ENTITY#USER} and by tenant under {@code ACCOUNT#<tenantId>#USERS}.
 * Workstream assignments are separate items in the same partition.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Principal {

    public String id;

    public String tenantId;

    public String enterpriseId;

    public String firstName;

    public String middleName;

    public String lastName;

    /**
     * Sign-in email. Unique among the active principals of a tenant,
     * compared case-insensitively.
     */
    public String email;

    /**
     * Legacy role name. Only used when the principal has no group-derived role.
     */
    public String assignedRole;

    public String assignedGroup;

    /** ISO date as stored. */
    public String startDate;

    /** ISO date as stored; null means open-ended. */
    public String endDate;

    public PrincipalStatus status = PrincipalStatus.ACTIVE;

    public boolean technicalUser;

    /**
     * Subject id at the identity provider. Once set it is never cleared;
     * only reconciliation sets it when it is missing.
     */
    public String externalSubjectId;

    public Instant createdAt;

    public Instant updatedAt;

    /**
     * Assigned workstream ids. Only populated by reads that load the whole
     * partition.
     */
    public List<String> workstreamIds = new ArrayList<>();

    public Principal() {
    }

    public boolean isActive() {
        return status == PrincipalStatus.ACTIVE;
    }

    /**
     * Status active and the end date, if any, not yet passed.
     */
    public boolean isEffectivelyActive(LocalDate today) {
        if (!isActive()) {
            return false;
        }
        LocalDate end = IsoDates.parseDate(endDate);
        return end == null || !end.isBefore(today);
    }

    public boolean hasEmail(String candidate) {
        return email != null && candidate != null && email.trim().equalsIgnoreCase(candidate.trim());
    }

    public boolean hasExternalSubjectId() {
        return externalSubjectId != null && !externalSubjectId.isBlank();
    }

    public String displayName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        return (first + " " + last).trim();
    }
}
