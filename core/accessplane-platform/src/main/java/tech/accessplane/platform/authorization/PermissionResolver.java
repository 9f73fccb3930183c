package tech.accessplane.platform.authorization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.principal.Principal;
import tech.accessplane.platform.principal.PrincipalRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a caller's effective permissions by walking
 * principal → groups → roles → menu permissions.
 *
 * <p>Resolution:
 * <ol>
 *   <li>Active principals with the caller's email (case-insensitive). With
 *       several matches and a tenant given, the matches in that tenant are
 *       preferred when there are any. The most recently created match wins.</li>
 *   <li>Role ids of all the principal's groups, deduplicated in first-seen order.</li>
 *   <li>No group role: the role named by the principal's legacy
 *       {@code assignedRole}, if one exists.</li>
 *   <li>Permissions of all roles merged monotonically ({@link PermissionMerger}).</li>
 * </ol>
 *
 * <p>A caller without a matching principal gets empty permissions, not an error.
 */
@ApplicationScoped
public class PermissionResolver {

    private static final Logger LOG = Logger.getLogger(PermissionResolver.class);

    static final Comparator<Principal> MOST_RECENT_FIRST = Comparator
        .comparing((Principal p) -> p.createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(p -> p.id, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    AccessGraphRepository graphRepo;

    public ResolvedPermissions resolve(String callerEmail, String tenantId) {
        if (callerEmail == null || callerEmail.isBlank()) {
            return ResolvedPermissions.none();
        }

        Optional<Principal> match = selectPrincipal(principalRepo.findActiveByEmail(callerEmail), tenantId);
        if (match.isEmpty()) {
            LOG.debugf("No active technical user for %s", callerEmail);
            return ResolvedPermissions.none();
        }
        Principal principal = match.get();

        Set<String> roleIds = new LinkedHashSet<>();
        for (String groupId : graphRepo.findGroupIds(principal.id)) {
            roleIds.addAll(graphRepo.findRoleIds(groupId));
        }

        Role displayRole = null;
        if (roleIds.isEmpty() && principal.assignedRole != null && !principal.assignedRole.isBlank()) {
            displayRole = graphRepo.findRoleByName(principal.assignedRole).orElse(null);
            if (displayRole != null) {
                roleIds.add(displayRole.id());
            }
        }

        if (roleIds.isEmpty()) {
            return ResolvedPermissions.noRole(principal.id);
        }

        if (displayRole == null) {
            String firstRoleId = roleIds.iterator().next();
            displayRole = graphRepo.findRole(firstRoleId).orElse(new Role(firstRoleId, null));
        }

        PermissionMerger merger = new PermissionMerger();
        for (String roleId : roleIds) {
            merger.addAll(graphRepo.findPermissions(roleId));
        }

        List<MenuPermission> permissions = merger.result();
        LOG.debugf("Resolved permissions for %s: %d menus from %d roles", callerEmail, permissions.size(), roleIds.size());
        return new ResolvedPermissions(permissions, displayRole.id(), displayRole.name(), principal.id);
    }

    static Optional<Principal> selectPrincipal(List<Principal> matches, String tenantId) {
        List<Principal> candidates = matches;
        if (matches.size() > 1 && tenantId != null) {
            List<Principal> inTenant = matches.stream()
                .filter(p -> tenantId.equals(p.tenantId))
                .toList();
            if (!inTenant.isEmpty()) {
                candidates = inTenant;
            }
        }
        return candidates.stream().min(MOST_RECENT_FIRST);
    }
}
