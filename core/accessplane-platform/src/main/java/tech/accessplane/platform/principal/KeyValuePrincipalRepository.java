package tech.accessplane.platform.principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.accessplane.platform.principal.mapper.PrincipalItemMapper;
import tech.accessplane.platform.store.Item;
import tech.accessplane.platform.store.KeyCondition;
import tech.accessplane.platform.store.KeySpace;
import tech.accessplane.platform.store.KeyValueStore;
import tech.accessplane.platform.store.StoreIndex;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store implementation of PrincipalRepository.
 */
@ApplicationScoped
public class KeyValuePrincipalRepository implements PrincipalRepository {

    @Inject
    KeyValueStore store;

    @Override
    public Optional<Principal> findById(String id) {
        return store.get(KeySpace.userMetadata(id)).map(PrincipalItemMapper::toDomain);
    }

    @Override
    public Optional<Principal> findByIdWithWorkstreams(String id) {
        List<Item> items = findPartitionItems(id);
        Optional<Principal> principal = items.stream()
            .filter(item -> KeySpace.METADATA.equals(item.getString(KeySpace.SK)))
            .findFirst()
            .map(PrincipalItemMapper::toDomain);
        principal.ifPresent(p -> p.workstreamIds = items.stream()
            .filter(item -> item.getString(KeySpace.SK).startsWith(KeySpace.WORKSTREAM_PREFIX))
            .map(PrincipalItemMapper::workstreamIdOf)
            .toList());
        return principal;
    }

    @Override
    public List<Principal> findAll() {
        return store.queryByIndex(StoreIndex.BY_TYPE, KeyCondition.partition(KeySpace.ENTITY_USER))
            .stream()
            .map(PrincipalItemMapper::toDomain)
            .toList();
    }

    @Override
    public List<Principal> findByTenant(String tenantId) {
        return store.queryByIndex(StoreIndex.BY_TENANT, KeyCondition.partition(KeySpace.accountUsers(tenantId)))
            .stream()
            .map(PrincipalItemMapper::toDomain)
            .toList();
    }

    @Override
    public List<Principal> findActiveByEmail(String email) {
        return findAll().stream()
            .filter(p -> p.hasEmail(email) && p.isActive())
            .toList();
    }

    @Override
    public List<String> findWorkstreamIds(String principalId) {
        return store.query(KeyCondition.beginsWith(KeySpace.user(principalId), KeySpace.WORKSTREAM_PREFIX))
            .stream()
            .map(PrincipalItemMapper::workstreamIdOf)
            .toList();
    }

    @Override
    public List<Item> findPartitionItems(String principalId) {
        return store.query(KeyCondition.partition(KeySpace.user(principalId)));
    }

    @Override
    public Principal updateAttributes(String id, Map<String, ?> attributes) {
        return PrincipalItemMapper.toDomain(store.update(KeySpace.userMetadata(id), attributes));
    }
}
