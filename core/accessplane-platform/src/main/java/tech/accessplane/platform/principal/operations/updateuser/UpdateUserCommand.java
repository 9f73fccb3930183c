package tech.accessplane.platform.principal.operations.updateuser;

import tech.accessplane.platform.principal.PrincipalStatus;

/**
 * Command to update a principal. Null fields are left unchanged.
 */
public record UpdateUserCommand(
    String principalId,
    String firstName,
    String middleName,
    String lastName,
    String email,
    String assignedRole,
    String assignedGroup,
    String startDate,
    String endDate,
    PrincipalStatus status
) {}
