package tech.accessplane.platform.principal.operations.deleteuser;

/**
 * Command to delete a principal with everything stored under it.
 *
 * @param principalId ID of the principal to delete
 */
public record DeleteUserCommand(String principalId) {}
