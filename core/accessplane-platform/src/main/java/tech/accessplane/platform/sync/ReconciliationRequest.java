package tech.accessplane.platform.sync;

/**
 * Parameters of a reconciliation run.
 *
 * @param tenantId        limit the run to one tenant; null for all tenants
 * @param dryRun          report what would be processed without writing anything
 * @param includeInactive also process principals whose status is inactive
 */
public record ReconciliationRequest(String tenantId, boolean dryRun, boolean includeInactive) {

    public static ReconciliationRequest all() {
        return new ReconciliationRequest(null, false, false);
    }

    public static ReconciliationRequest forTenant(String tenantId) {
        return new ReconciliationRequest(tenantId, false, false);
    }

    public ReconciliationRequest asDryRun() {
        return new ReconciliationRequest(tenantId, true, includeInactive);
    }
}
