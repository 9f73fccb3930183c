package tech.accessplane.platform.tenant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One tenant visible to a caller.
 */
public record TenantAccess(
    @JsonProperty("accountId") String tenantId,
    @JsonProperty("accountName") String tenantName,
    String enterpriseId,
    String enterpriseName
) {}
