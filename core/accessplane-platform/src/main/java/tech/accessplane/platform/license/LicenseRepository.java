package tech.accessplane.platform.license;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.accessplane.platform.store.Item;
import tech.accessplane.platform.store.KeyCondition;
import tech.accessplane.platform.store.KeySpace;
import tech.accessplane.platform.store.KeyValueStore;

import java.util.List;

/**
 * Read access to tenant licenses.
 */
@ApplicationScoped
public class LicenseRepository {

    @Inject
    KeyValueStore store;

    public List<License> findByTenant(String tenantId) {
        return store.query(KeyCondition.beginsWith(KeySpace.account(tenantId), KeySpace.LICENSE_PREFIX))
            .stream()
            .map(item -> toLicense(tenantId, item))
            .toList();
    }

    private static License toLicense(String tenantId, Item item) {
        String id = item.findString("id")
            .orElse(item.getString(KeySpace.SK).substring(KeySpace.LICENSE_PREFIX.length()));
        return License.fromAttributes(
            id,
            tenantId,
            item.getString("enterpriseId"),
            item.getString("productId"),
            item.getLong("numberOfUsers", 0),
            item.getString("endDate")
        );
    }
}
