package tech.accessplane.platform.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.common.ExecutionContext;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.common.SideEffectOutcome;
import tech.accessplane.platform.common.errors.UseCaseError;
import tech.accessplane.platform.identity.IdentityProviderAdapter;
import tech.accessplane.platform.identity.ProvisionResult;
import tech.accessplane.platform.notification.NotificationContext;
import tech.accessplane.platform.notification.Recipient;
import tech.accessplane.platform.principal.IdentityProvisioningService;
import tech.accessplane.platform.principal.Principal;
import tech.accessplane.platform.principal.PrincipalRepository;
import tech.accessplane.platform.principal.mapper.PrincipalItemMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Repairs drift between stored principals and the identity provider.
 *
 * <p>Selects the principals without an identity-provider subject id (active
 * ones only, unless inactive ones are requested) and provisions each of them
 * upstream. The provider call is idempotent, so a principal that already
 * exists upstream is reported as {@code updated}. The returned subject id is
 * then stored on the principal.
 *
 * <p>Principals are processed one at a time, which bounds the request rate
 * against the provider. A failure on one principal is recorded in the report
 * and processing continues with the next. Because selection requires a
 * missing subject id, a second run only picks up what is still missing.
 */
@ApplicationScoped
public class IdentityReconciliationService {

    private static final Logger LOG = Logger.getLogger(IdentityReconciliationService.class);

    static final String DRY_RUN_REASON = "Dry run, no changes applied";

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    IdentityProviderAdapter identityProvider;

    @Inject
    IdentityProvisioningService provisioning;

    public Result<ReconciliationSummary> reconcile(ReconciliationRequest request, ExecutionContext context) {
        if (!identityProvider.isConfigured()) {
            return Result.failure(new UseCaseError.NotConfigured(
                "IDENTITY_PROVIDER_NOT_CONFIGURED",
                "Identity provider is not configured (user pool id missing). Cannot reconcile.",
                Map.of()
            ));
        }

        LOG.infof("[%s] Starting reconciliation (dryRun=%s, tenant=%s, includeInactive=%s)",
            context.executionId(), request.dryRun(),
            request.tenantId() != null ? request.tenantId() : "ALL", request.includeInactive());

        List<Principal> scanned = request.tenantId() != null
            ? principalRepo.findByTenant(request.tenantId())
            : principalRepo.findAll();

        List<Principal> targets = scanned.stream()
            .filter(p -> !p.hasExternalSubjectId())
            .filter(p -> request.includeInactive() || p.isActive())
            .toList();

        LOG.infof("[%s] Reconciliation scan: %d principals, %d missing a subject id",
            context.executionId(), scanned.size(), targets.size());

        List<ReconciliationItemResult> details = new ArrayList<>();
        for (Principal principal : targets) {
            if (request.dryRun()) {
                details.add(ReconciliationItemResult.skipped(principal.id, principal.email, DRY_RUN_REASON));
                continue;
            }
            details.add(reconcileOne(principal, context));
        }

        ReconciliationSummary summary = new ReconciliationSummary(
            scanned.size(),
            targets.size(),
            count(details, ReconciliationStatus.PROVISIONED),
            count(details, ReconciliationStatus.UPDATED),
            count(details, ReconciliationStatus.SKIPPED),
            count(details, ReconciliationStatus.FAILED),
            request.dryRun(),
            details
        );

        LOG.infof("[%s] Reconciliation complete: scanned=%d, missing=%d, provisioned=%d, updated=%d, skipped=%d, failed=%d",
            context.executionId(), summary.totalScanned(), summary.missingExternalId(), summary.provisioned(),
            summary.updated(), summary.skipped(), summary.failed());

        return Result.success(summary);
    }

    private ReconciliationItemResult reconcileOne(Principal principal, ExecutionContext context) {
        try {
            ProvisionResult result = identityProvider.createUser(IdentityProvisioningService.profileOf(principal));

            if (result.skipped()) {
                return ReconciliationItemResult.skipped(principal.id, principal.email, result.reason());
            }

            if (result.externalSubjectId() != null) {
                Map<String, Object> patch = new LinkedHashMap<>();
                patch.put(PrincipalItemMapper.ATTR_EXTERNAL_SUBJECT_ID, result.externalSubjectId());
                patch.put(PrincipalItemMapper.ATTR_UPDATED_AT, Instant.now().toString());
                principalRepo.updateAttributes(principal.id, patch);
            }

            if (!result.created()) {
                LOG.infof("[%s] Reconciled (updated): %s -> %s",
                    context.executionId(), principal.email, result.externalSubjectId());
                return new ReconciliationItemResult(principal.id, principal.email, ReconciliationStatus.UPDATED,
                    result.externalSubjectId(), null, null);
            }

            LOG.infof("[%s] Reconciled (created): %s -> %s",
                context.executionId(), principal.email, result.externalSubjectId());
            SideEffectOutcome notification = provisioning.notifyCredentials(
                new IdentityProvisioningService.Attempt(result, result.toOutcome()),
                new Recipient(principal.email, principal.firstName, principal.lastName),
                new NotificationContext(principal.tenantId, null, principal.id)
            );
            return new ReconciliationItemResult(principal.id, principal.email, ReconciliationStatus.PROVISIONED,
                result.externalSubjectId(), null, notification);
        } catch (RuntimeException e) {
            LOG.errorf("[%s] Reconciliation failed for %s: %s", context.executionId(), principal.email, e.getMessage());
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ReconciliationItemResult.failed(principal.id, principal.email, reason);
        }
    }

    private static int count(List<ReconciliationItemResult> details, ReconciliationStatus status) {
        return (int) details.stream().filter(d -> d.status() == status).count();
    }
}
