package tech.accessplane.platform.principal;

import tech.accessplane.platform.identity.IdentityProviderAdapter;
import tech.accessplane.platform.notification.NotificationDispatcher;
import tech.accessplane.platform.principal.mapper.PrincipalItemMapper;
import tech.accessplane.platform.store.KeyValueStore;

import java.time.Instant;

/**
 * Principals and a store-backed repository for tests in other packages.
 */
public final class PrincipalFixtures {

    private PrincipalFixtures() {
    }

    public static KeyValuePrincipalRepository repositoryOver(KeyValueStore store) {
        KeyValuePrincipalRepository repository = new KeyValuePrincipalRepository();
        repository.store = store;
        return repository;
    }

    public static IdentityProvisioningService provisioningWith(IdentityProviderAdapter identityProvider,
                                                               NotificationDispatcher notificationDispatcher) {
        IdentityProvisioningService service = new IdentityProvisioningService();
        service.identityProvider = identityProvider;
        service.notificationDispatcher = notificationDispatcher;
        return service;
    }

    public static Principal principal(String id, String tenantId, String email) {
        Principal principal = new Principal();
        principal.id = id;
        principal.tenantId = tenantId;
        principal.email = email;
        principal.firstName = "First " + id;
        principal.lastName = "Last " + id;
        principal.status = PrincipalStatus.ACTIVE;
        principal.createdAt = Instant.parse("2025-01-01T00:00:00Z");
        principal.updatedAt = principal.createdAt;
        return principal;
    }

    public static Principal inactive(Principal principal) {
        principal.status = PrincipalStatus.INACTIVE;
        return principal;
    }

    /**
     * Write the principal's metadata item straight to the store.
     */
    public static Principal save(KeyValueStore store, Principal principal) {
        store.put(PrincipalItemMapper.toItem(principal));
        return principal;
    }
}
