package tech.accessplane.platform.authorization;

import java.util.List;

/**
 * Effective permissions of a caller.
 *
 * @param permissions     merged permissions, one per menu key
 * @param roleId          first resolved role, for display; null when no role resolved
 * @param roleName        name of that role
 * @param technicalUserId matched principal; null when the caller matched none
 */
public record ResolvedPermissions(
    List<MenuPermission> permissions,
    String roleId,
    String roleName,
    String technicalUserId
) {

    public static ResolvedPermissions none() {
        return new ResolvedPermissions(List.of(), null, null, null);
    }

    public static ResolvedPermissions noRole(String technicalUserId) {
        return new ResolvedPermissions(List.of(), null, null, technicalUserId);
    }
}
