package tech.accessplane.platform.authorization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.accessplane.platform.store.Item;
import tech.accessplane.platform.store.KeyCondition;
import tech.accessplane.platform.store.KeySpace;
import tech.accessplane.platform.store.KeyValueStore;
import tech.accessplane.platform.store.StoreIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the authorization graph stored as key-prefixed item collections:
 * <pre>
 * USER#&lt;id&gt;     / GROUP#&lt;groupId&gt;        membership
 * GROUP#&lt;id&gt;    / ROLE#&lt;roleId&gt;          group to role link
 * ROLE#&lt;id&gt;     / PERMISSION#&lt;menuKey&gt;   role permission
 * ROLE#&lt;id&gt;     / METADATA               role
 * </pre>
 * Each hop is a prefix query on one partition.
 */
@ApplicationScoped
public class AccessGraphRepository {

    @Inject
    KeyValueStore store;

    public List<String> findGroupIds(String principalId) {
        return store.query(KeyCondition.beginsWith(KeySpace.user(principalId), KeySpace.GROUP_PREFIX))
            .stream()
            .map(item -> idAttributeOrSuffix(item, "groupId", KeySpace.GROUP_PREFIX))
            .toList();
    }

    public List<String> findRoleIds(String groupId) {
        return store.query(KeyCondition.beginsWith(KeySpace.group(groupId), KeySpace.ROLE_PREFIX))
            .stream()
            .map(item -> idAttributeOrSuffix(item, "roleId", KeySpace.ROLE_PREFIX))
            .toList();
    }

    public Optional<Role> findRole(String roleId) {
        return store.get(KeySpace.roleMetadata(roleId)).map(AccessGraphRepository::toRole);
    }

    /**
     * Role with exactly this name, if any.
     */
    public Optional<Role> findRoleByName(String name) {
        return store.queryByIndex(StoreIndex.BY_TYPE, KeyCondition.partition(KeySpace.ENTITY_ROLE))
            .stream()
            .filter(item -> name.equals(item.getString("name")))
            .findFirst()
            .map(AccessGraphRepository::toRole);
    }

    public List<MenuPermission> findPermissions(String roleId) {
        return store.query(KeyCondition.beginsWith(KeySpace.role(roleId), KeySpace.PERMISSION_PREFIX))
            .stream()
            .map(AccessGraphRepository::toPermission)
            .toList();
    }

    private static Role toRole(Item item) {
        return new Role(
            idAttributeOrSuffix(item, "id", KeySpace.ROLE_PREFIX, KeySpace.PK),
            item.getString("name")
        );
    }

    private static MenuPermission toPermission(Item item) {
        List<TabPermission> tabs = new ArrayList<>();
        for (Object tab : item.getList("tabs")) {
            if (tab instanceof Map<?, ?> map && map.get("key") != null) {
                Object label = map.get("label");
                Object visible = map.get("isVisible");
                tabs.add(new TabPermission(
                    map.get("key").toString(),
                    label != null ? label.toString() : null,
                    visible == null || Boolean.parseBoolean(visible.toString())
                ));
            }
        }
        return new MenuPermission(
            idAttributeOrSuffix(item, "menuKey", KeySpace.PERMISSION_PREFIX),
            item.getString("menuLabel"),
            item.getBoolean("isVisible", false),
            item.getBoolean("canCreate", false),
            item.getBoolean("canView", false),
            item.getBoolean("canEdit", false),
            item.getBoolean("canDelete", false),
            tabs
        );
    }

    private static String idAttributeOrSuffix(Item item, String attribute, String prefix) {
        return idAttributeOrSuffix(item, attribute, prefix, KeySpace.SK);
    }

    private static String idAttributeOrSuffix(Item item, String attribute, String prefix, String keyAttribute) {
        return item.findString(attribute)
            .orElseGet(() -> item.getString(keyAttribute).substring(prefix.length()));
    }
}
