package tech.accessplane.platform.tenant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.principal.Principal;
import tech.accessplane.platform.principal.PrincipalRepository;
import tech.accessplane.platform.store.StoreException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves which tenants a caller can work in.
 *
 * <p>Super-admins (role or group claim, or the platform admin email) see every
 * tenant. Everybody else sees the tenants in which an active principal with
 * their email exists. Tenant and enterprise names come from point lookups; a
 * failed lookup degrades to a placeholder name.
 */
@ApplicationScoped
public class AccessResolver {

    private static final Logger LOG = Logger.getLogger(AccessResolver.class);

    static final String UNKNOWN_TENANT_NAME = "Unknown";

    @Inject
    TenantRepository tenantRepo;

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    AccessConfig config;

    public AccessSummary resolve(CallerIdentity caller) {
        if (isSuperAdmin(caller)) {
            List<TenantAccess> tenants = new ArrayList<>();
            for (Tenant tenant : dedupe(tenantRepo.findAll())) {
                String enterpriseName = tenant.enterpriseName();
                if (enterpriseName == null && tenant.enterpriseId() != null) {
                    enterpriseName = lookupEnterpriseName(tenant.enterpriseId());
                }
                tenants.add(new TenantAccess(tenant.id(), tenant.name(), tenant.enterpriseId(), enterpriseName));
            }
            return new AccessSummary(true, tenants);
        }

        if (caller.email() == null || caller.email().isBlank()) {
            return new AccessSummary(false, List.of());
        }

        Map<String, TenantAccess> byTenant = new LinkedHashMap<>();
        for (Principal principal : principalRepo.findActiveByEmail(caller.email())) {
            if (principal.tenantId == null || byTenant.containsKey(principal.tenantId)) {
                continue;
            }
            String enterpriseName = principal.enterpriseId != null
                ? lookupEnterpriseName(principal.enterpriseId)
                : null;
            byTenant.put(principal.tenantId, new TenantAccess(
                principal.tenantId,
                lookupTenantName(principal.tenantId),
                principal.enterpriseId,
                enterpriseName
            ));
        }
        return new AccessSummary(false, new ArrayList<>(byTenant.values()));
    }

    public boolean isSuperAdmin(CallerIdentity caller) {
        String superAdminRole = config.superAdminRole();
        if (superAdminRole.equals(caller.role()) || caller.groups().contains(superAdminRole)) {
            return true;
        }
        return caller.email() != null && caller.email().trim().equalsIgnoreCase(config.platformAdminEmail());
    }

    private String lookupTenantName(String tenantId) {
        try {
            return tenantRepo.findById(tenantId)
                .map(Tenant::name)
                .orElse(UNKNOWN_TENANT_NAME);
        } catch (StoreException e) {
            LOG.warnf("Tenant lookup failed for %s: %s", tenantId, e.getMessage());
            return UNKNOWN_TENANT_NAME;
        }
    }

    private String lookupEnterpriseName(String enterpriseId) {
        try {
            return tenantRepo.findEnterprise(enterpriseId)
                .map(Enterprise::name)
                .orElse(null);
        } catch (StoreException e) {
            LOG.warnf("Enterprise lookup failed for %s: %s", enterpriseId, e.getMessage());
            return null;
        }
    }

    private static List<Tenant> dedupe(List<Tenant> tenants) {
        Map<String, Tenant> byId = new LinkedHashMap<>();
        for (Tenant tenant : tenants) {
            byId.putIfAbsent(tenant.id(), tenant);
        }
        return new ArrayList<>(byId.values());
    }
}
