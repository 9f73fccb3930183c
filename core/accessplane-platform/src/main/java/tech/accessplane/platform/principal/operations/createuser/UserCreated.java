package tech.accessplane.platform.principal.operations.createuser;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.accessplane.platform.common.SideEffectOutcome;
import tech.accessplane.platform.license.LicenseCapacity;
import tech.accessplane.platform.principal.Principal;

/**
 * Result of a successful creation.
 *
 * @param principal        the stored principal, with its workstream ids
 * @param licenseCapacity  capacity after this creation, computed locally
 * @param identityProvider outcome of the identity provider call
 * @param notification     outcome of the credential email
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserCreated(
    Principal principal,
    LicenseCapacity licenseCapacity,
    SideEffectOutcome identityProvider,
    SideEffectOutcome notification
) {}
