package tech.accessplane.platform.identity;

/**
 * Managed identity provider holding the sign-in identity of each principal.
 *
 * <p>The key-value store is the system of record. Every call here is a side
 * effect that callers treat as best-effort: failures are caught, logged and
 * reported, never allowed to fail the authoritative write.
 *
 * <p>All methods may throw {@link IdentityProviderUnavailableException} on
 * transient failures and {@link IdentityProviderException} on rejection.
 */
public interface IdentityProviderAdapter {

    /**
     * Create the principal upstream. Idempotent: if a principal with the same
     * email already exists its attributes are updated and the result reports
     * {@code updated=true}. When the provider is not configured the result
     * reports {@code skipped=true}.
     */
    ProvisionResult createUser(UserProfile profile);

    /**
     * Update attributes (and enabled state) of an existing principal.
     *
     * @throws IdentityProviderException if the principal does not exist upstream
     */
    void updateUser(UserProfile profile);

    /**
     * Delete the principal upstream. A missing principal is reported as
     * {@code skipped}, not as an error.
     */
    DeprovisionResult deleteUser(String email);

    /**
     * Whether a usable provider configuration is present.
     */
    boolean isConfigured();
}
