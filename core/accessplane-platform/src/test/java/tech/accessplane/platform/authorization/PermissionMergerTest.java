package tech.accessplane.platform.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PermissionMergerTest {

    @Test
    @DisplayName("result should keep one entry per menu key in first-seen order")
    void result_shouldKeepOneEntryPerMenu() {
        List<MenuPermission> merged = new PermissionMerger()
            .add(menu("users", false, true, false, false))
            .add(menu("security", false, true, false, false))
            .add(menu("users", false, false, true, false))
            .result();

        assertThat(merged).extracting(MenuPermission::menuKey).containsExactly("users", "security");
    }

    @Test
    @DisplayName("add should only ever escalate flags")
    void add_shouldOnlyEscalateFlags() {
        List<MenuPermission> merged = new PermissionMerger()
            .add(menu("users", true, true, true, true))
            .add(menu("users", false, false, false, false))
            .result();

        MenuPermission users = merged.get(0);
        assertThat(users.canCreate()).isTrue();
        assertThat(users.canView()).isTrue();
        assertThat(users.canEdit()).isTrue();
        assertThat(users.canDelete()).isTrue();
        assertThat(users.visible()).isTrue();
    }

    @Test
    @DisplayName("add should append new tabs and reveal a known tab shown by either side")
    void add_shouldMergeTabs() {
        MenuPermission first = new MenuPermission("users", "Users", true, false, true, false, false, List.of(
            new TabPermission("profile", "Profile", true),
            new TabPermission("audit", "Audit", false)
        ));
        MenuPermission second = new MenuPermission("users", "People", true, false, true, false, false, List.of(
            new TabPermission("audit", "Audit", true),
            new TabPermission("profile", "Profile", false),
            new TabPermission("billing", "Billing", false)
        ));

        MenuPermission merged = new PermissionMerger().add(first).add(second).result().get(0);

        assertThat(merged.menuLabel()).isEqualTo("Users");
        assertThat(merged.tabs()).containsExactly(
            new TabPermission("profile", "Profile", true),
            new TabPermission("audit", "Audit", true),
            new TabPermission("billing", "Billing", false)
        );
    }

    @Test
    @DisplayName("result should be empty when nothing was added")
    void result_shouldBeEmpty_whenNothingAdded() {
        assertThat(new PermissionMerger().result()).isEmpty();
    }

    static MenuPermission menu(String key, boolean create, boolean view, boolean edit, boolean delete) {
        return new MenuPermission(key, key, true, create, view, edit, delete, List.of());
    }
}
