package tech.accessplane.platform.principal;

import tech.accessplane.platform.store.Item;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for Principal entities.
 * Exposes only the operations the lifecycle, capacity and reconciliation
 * services need.
 */
public interface PrincipalRepository {

    // Read operations
    Optional<Principal> findById(String id);

    /**
     * The principal together with its workstream ids.
     */
    Optional<Principal> findByIdWithWorkstreams(String id);

    List<Principal> findAll();

    List<Principal> findByTenant(String tenantId);

    /**
     * Active principals whose email matches, case-insensitively, across all tenants.
     */
    List<Principal> findActiveByEmail(String email);

    List<String> findWorkstreamIds(String principalId);

    /**
     * Every item stored under the principal's partition: metadata,
     * workstream assignments and group memberships.
     */
    List<Item> findPartitionItems(String principalId);

    // Write operations

    /**
     * Set the given metadata attributes (stored attribute names) and return
     * the principal as stored afterwards. Null values are skipped.
     */
    Principal updateAttributes(String id, Map<String, ?> attributes);
}
