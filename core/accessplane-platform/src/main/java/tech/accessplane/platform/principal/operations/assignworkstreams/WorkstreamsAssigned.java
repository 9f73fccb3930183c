package tech.accessplane.platform.principal.operations.assignworkstreams;

import java.util.List;

/**
 * @param added   workstreams that were not assigned before
 * @param removed workstreams no longer assigned
 */
public record WorkstreamsAssigned(
    String principalId,
    List<String> workstreamIds,
    List<String> added,
    List<String> removed
) {}
