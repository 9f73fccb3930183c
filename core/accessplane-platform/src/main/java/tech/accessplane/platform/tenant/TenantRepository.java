package tech.accessplane.platform.tenant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.accessplane.platform.store.Item;
import tech.accessplane.platform.store.KeyCondition;
import tech.accessplane.platform.store.KeySpace;
import tech.accessplane.platform.store.KeyValueStore;
import tech.accessplane.platform.store.StoreIndex;

import java.util.List;
import java.util.Optional;

/**
 * Read access to tenant and enterprise metadata.
 */
@ApplicationScoped
public class TenantRepository {

    @Inject
    KeyValueStore store;

    public List<Tenant> findAll() {
        return store.queryByIndex(StoreIndex.BY_TYPE, KeyCondition.partition(KeySpace.ENTITY_ACCOUNT))
            .stream()
            .map(TenantRepository::toTenant)
            .toList();
    }

    public Optional<Tenant> findById(String tenantId) {
        return store.get(KeySpace.accountMetadata(tenantId)).map(TenantRepository::toTenant);
    }

    public Optional<Enterprise> findEnterprise(String enterpriseId) {
        return store.get(KeySpace.enterpriseMetadata(enterpriseId))
            .map(item -> new Enterprise(
                item.findString("id").orElse(enterpriseId),
                item.getString("name")
            ));
    }

    private static Tenant toTenant(Item item) {
        return new Tenant(
            item.findString("id")
                .orElseGet(() -> item.getString(KeySpace.PK).substring(KeySpace.ACCOUNT_PREFIX.length())),
            item.getString("name"),
            item.findString("enterpriseId").orElse(null),
            item.findString("enterpriseName").orElse(null)
        );
    }
}
