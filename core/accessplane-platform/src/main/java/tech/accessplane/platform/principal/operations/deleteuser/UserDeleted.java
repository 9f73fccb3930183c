package tech.accessplane.platform.principal.operations.deleteuser;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.accessplane.platform.common.SideEffectOutcome;

/**
 * @param itemsDeleted number of store items removed (metadata, assignments, memberships)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserDeleted(
    String principalId,
    String email,
    int itemsDeleted,
    SideEffectOutcome identityProvider
) {}
