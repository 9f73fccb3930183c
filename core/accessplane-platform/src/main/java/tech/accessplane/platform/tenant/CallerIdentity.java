package tech.accessplane.platform.tenant;

import java.util.List;

/**
 * The authenticated caller, as asserted by the identity provider token.
 *
 * @param email  sign-in email
 * @param role   role claim, may be null
 * @param groups group claims, may be empty
 */
public record CallerIdentity(String email, String role, List<String> groups) {

    public CallerIdentity {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }
}
