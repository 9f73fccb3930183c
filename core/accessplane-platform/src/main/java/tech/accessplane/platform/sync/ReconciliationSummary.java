package tech.accessplane.platform.sync;

import java.util.List;

/**
 * Report of a reconciliation run.
 *
 * @param totalScanned      principals loaded for the scope
 * @param missingExternalId principals selected for processing
 * @param details           one entry per selected principal, in processing order
 */
public record ReconciliationSummary(
    int totalScanned,
    int missingExternalId,
    int provisioned,
    int updated,
    int skipped,
    int failed,
    boolean dryRun,
    List<ReconciliationItemResult> details
) {}
