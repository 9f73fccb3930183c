package tech.accessplane.platform.authorization;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * What a role grants on one menu: visibility, the four action flags and
 * per-tab visibility.
 */
public record MenuPermission(
    String menuKey,
    String menuLabel,
    @JsonProperty("isVisible") boolean visible,
    boolean canCreate,
    boolean canView,
    boolean canEdit,
    boolean canDelete,
    List<TabPermission> tabs
) {

    public MenuPermission {
        tabs = tabs == null ? List.of() : List.copyOf(tabs);
    }

    /**
     * Combine the grants of another role for the same menu. Flags only ever
     * escalate: each flag is the OR of both sides. Tabs are merged by key;
     * a tab new to this menu is appended, a known tab becomes visible if
     * either side shows it. The label of this side wins.
     */
    public MenuPermission mergedWith(MenuPermission other) {
        List<TabPermission> mergedTabs = new ArrayList<>(tabs);
        for (TabPermission tab : other.tabs) {
            int index = indexOfTab(mergedTabs, tab.key());
            if (index < 0) {
                mergedTabs.add(tab);
            } else if (tab.visible()) {
                mergedTabs.set(index, mergedTabs.get(index).withVisible(true));
            }
        }
        return new MenuPermission(
            menuKey,
            menuLabel != null ? menuLabel : other.menuLabel,
            visible || other.visible,
            canCreate || other.canCreate,
            canView || other.canView,
            canEdit || other.canEdit,
            canDelete || other.canDelete,
            mergedTabs
        );
    }

    private static int indexOfTab(List<TabPermission> tabs, String key) {
        for (int i = 0; i < tabs.size(); i++) {
            if (tabs.get(i).key().equals(key)) {
                return i;
            }
        }
        return -1;
    }
}
