package tech.accessplane.platform.authorization;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Visibility of one named tab inside a menu.
 */
public record TabPermission(
    String key,
    String label,
    @JsonProperty("isVisible") boolean visible
) {

    public TabPermission withVisible(boolean visible) {
        return new TabPermission(key, label, visible);
    }
}
