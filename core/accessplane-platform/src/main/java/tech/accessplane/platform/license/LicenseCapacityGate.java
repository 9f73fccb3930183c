package tech.accessplane.platform.license;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.common.errors.UseCaseError;
import tech.accessplane.platform.principal.Principal;
import tech.accessplane.platform.principal.PrincipalRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Per-tenant active user ceiling.
 *
 * <p>Read-only. {@link #validateUserCreation} is a check only: the caller
 * creates the principal afterwards, so two concurrent creations at the
 * boundary can both pass and exceed the ceiling by one. There is no
 * reservation or conditional counter.
 */
@ApplicationScoped
public class LicenseCapacityGate {

    private static final Logger LOG = Logger.getLogger(LicenseCapacityGate.class);

    @Inject
    LicenseRepository licenseRepo;

    @Inject
    PrincipalRepository principalRepo;

    Clock clock = Clock.systemUTC();

    /**
     * Capacity of the tenant, without enforcing it.
     */
    public LicenseCapacity getCapacity(String tenantId) {
        LocalDate today = LocalDate.now(clock);

        List<License> activeLicenses = licenseRepo.findByTenant(tenantId).stream()
            .filter(license -> license.isActiveOn(today))
            .toList();

        long active = principalRepo.findByTenant(tenantId).stream()
            .filter(principal -> principal.isEffectivelyActive(today))
            .count();

        return LicenseCapacity.of(activeLicenses, active);
    }

    /**
     * Check that one more principal fits. See {@link #validateUserCreation(String, int)}.
     */
    public Result<LicenseCapacity> validateUserCreation(String tenantId) {
        return validateUserCreation(tenantId, 1);
    }

    /**
     * Capacity of the tenant, failing with {@code CapacityExceeded} when the
     * tenant has no active license ({@code LICENSE_NOT_FOUND}) or fewer than
     * {@code requestedCount} seats left ({@code LICENSE_CAPACITY_EXCEEDED}).
     */
    public Result<LicenseCapacity> validateUserCreation(String tenantId, int requestedCount) {
        if (requestedCount < 1) {
            throw new IllegalArgumentException("requestedCount must be at least 1, was " + requestedCount);
        }
        LicenseCapacity capacity = getCapacity(tenantId);

        if (capacity.totalAllowed() == 0) {
            LOG.warnf("Tenant %s has no active license, user creation blocked", tenantId);
            return Result.failure(new UseCaseError.CapacityExceeded(
                "LICENSE_NOT_FOUND",
                "No active licenses found for this tenant",
                Map.of("tenantId", tenantId)
            ));
        }

        if (capacity.remaining() < requestedCount) {
            LOG.warnf("License capacity reached for tenant %s: %d of %d seats in use, %d requested",
                tenantId, capacity.currentActiveUsers(), capacity.totalAllowed(), requestedCount);
            return Result.failure(new UseCaseError.CapacityExceeded(
                "LICENSE_CAPACITY_EXCEEDED",
                "License capacity reached: " + capacity.currentActiveUsers() + " of "
                    + capacity.totalAllowed() + " users are active, " + requestedCount + " requested",
                Map.of(
                    "tenantId", tenantId,
                    "totalAllowed", capacity.totalAllowed(),
                    "currentActiveUsers", capacity.currentActiveUsers(),
                    "remaining", capacity.remaining(),
                    "requested", requestedCount
                )
            ));
        }

        LOG.debugf("License check passed for tenant %s: %s of %s seats in use, %s requested",
            tenantId, capacity.currentActiveUsers(), capacity.totalAllowed(), requestedCount);
        return Result.success(capacity);
    }
}
