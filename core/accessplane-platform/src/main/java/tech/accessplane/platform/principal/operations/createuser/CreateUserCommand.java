package tech.accessplane.platform.principal.operations.createuser;

import java.util.List;

/**
 * Command to create a principal in a tenant.
 *
 * @param tenantId      Tenant the principal belongs to (required)
 * @param tenantName    Tenant display name, only used in the credential email
 * @param enterpriseId  Enterprise of the tenant (nullable)
 * @param firstName     Required
 * @param middleName    Nullable
 * @param lastName      Required
 * @param email         Sign-in email (required)
 * @param assignedRole  Legacy role name (nullable)
 * @param assignedGroup Group name, also used as the identity provider group (nullable)
 * @param startDate     ISO date (nullable)
 * @param endDate       ISO date (nullable, open-ended when absent)
 * @param technicalUser Whether this is a technical user (defaults to false)
 * @param workstreamIds Workstreams to assign; duplicates are collapsed
 */
public record CreateUserCommand(
    String tenantId,
    String tenantName,
    String enterpriseId,
    String firstName,
    String middleName,
    String lastName,
    String email,
    String assignedRole,
    String assignedGroup,
    String startDate,
    String endDate,
    Boolean technicalUser,
    List<String> workstreamIds
) {}
