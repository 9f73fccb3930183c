package tech.accessplane.platform.tenant;

/**
 * A tenant (account), stored as {@code ACCOUNT#<id>} / {@code METADATA} and
 * listed under {@code ENTITY#ACCOUNT}. The enterprise name is denormalized
 * onto the tenant item where available.
 */
public record Tenant(String id, String name, String enterpriseId, String enterpriseName) {}
