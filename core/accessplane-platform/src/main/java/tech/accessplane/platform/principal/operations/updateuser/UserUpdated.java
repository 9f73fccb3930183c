package tech.accessplane.platform.principal.operations.updateuser;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.accessplane.platform.common.SideEffectOutcome;
import tech.accessplane.platform.principal.Principal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserUpdated(Principal principal, SideEffectOutcome identityProvider) {}
