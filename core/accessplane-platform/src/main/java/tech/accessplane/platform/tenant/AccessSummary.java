package tech.accessplane.platform.tenant;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Tenants visible to a caller. Never contains two entries for the same tenant.
 */
public record AccessSummary(
    @JsonProperty("isSuperAdmin") boolean superAdmin,
    @JsonProperty("accounts") List<TenantAccess> tenants
) {}
