package tech.accessplane.platform.authorization;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates menu permissions from several roles into one entry per menu key,
 * in first-seen order. See {@link MenuPermission#mergedWith}.
 */
public class PermissionMerger {

    private final Map<String, MenuPermission> byMenuKey = new LinkedHashMap<>();

    public PermissionMerger add(MenuPermission permission) {
        byMenuKey.merge(permission.menuKey(), permission, MenuPermission::mergedWith);
        return this;
    }

    public PermissionMerger addAll(List<MenuPermission> permissions) {
        permissions.forEach(this::add);
        return this;
    }

    public List<MenuPermission> result() {
        return new ArrayList<>(byMenuKey.values());
    }
}
