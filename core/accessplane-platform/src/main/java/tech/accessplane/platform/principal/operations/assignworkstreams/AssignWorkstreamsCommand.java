package tech.accessplane.platform.principal.operations.assignworkstreams;

import java.util.List;

/**
 * Command to replace the complete workstream set of a principal.
 *
 * @param principalId   ID of the principal
 * @param workstreamIds The new set; an empty list removes every assignment
 */
public record AssignWorkstreamsCommand(String principalId, List<String> workstreamIds) {}
