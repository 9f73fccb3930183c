package tech.accessplane.platform.principal.operations.updateuser;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.common.ExecutionContext;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.common.SideEffectOutcome;
import tech.accessplane.platform.common.UseCase;
import tech.accessplane.platform.common.errors.UseCaseError;
import tech.accessplane.platform.identity.IdentityProviderAdapter;
import tech.accessplane.platform.identity.UserProfile;
import tech.accessplane.platform.principal.Principal;
import tech.accessplane.platform.principal.PrincipalRepository;
import tech.accessplane.platform.principal.PrincipalStatus;
import tech.accessplane.platform.principal.mapper.PrincipalItemMapper;
import tech.accessplane.platform.store.StoreException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Use case for updating a principal in place.
 *
 * <p>Only the fields present in the command are written, plus
 * {@code updatedAt}. The identity-provider subject id is never touched.
 * The changed attributes are then synced upstream on a best-effort basis,
 * looked up by the email the principal had before the update.
 */
@ApplicationScoped
public class UpdateUserUseCase implements UseCase<UpdateUserCommand, UserUpdated> {

    private static final Logger LOG = Logger.getLogger(UpdateUserUseCase.class);

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    IdentityProviderAdapter identityProvider;

    @Override
    public Result<UserUpdated> execute(UpdateUserCommand command, ExecutionContext context) {
        Principal existing = principalRepo.findById(command.principalId()).orElse(null);
        if (existing == null) {
            return Result.failure(new UseCaseError.NotFoundError(
                "USER_NOT_FOUND",
                "User not found",
                Map.of("principalId", String.valueOf(command.principalId()))
            ));
        }

        String newEmail = command.email() != null ? command.email().trim() : null;
        if (newEmail != null && !existing.hasEmail(newEmail)) {
            if (newEmail.indexOf('@') <= 0 || newEmail.indexOf('@') == newEmail.length() - 1) {
                return Result.failure(new UseCaseError.ValidationError(
                    "INVALID_EMAIL",
                    "Invalid email format",
                    Map.of("email", newEmail)
                ));
            }
            PrincipalStatus resultingStatus = command.status() != null ? command.status() : existing.status;
            boolean emailTaken = resultingStatus == PrincipalStatus.ACTIVE
                && principalRepo.findByTenant(existing.tenantId).stream()
                    .anyMatch(p -> !p.id.equals(existing.id) && p.isActive() && p.hasEmail(newEmail));
            if (emailTaken) {
                return Result.failure(new UseCaseError.ValidationError(
                    "EMAIL_EXISTS",
                    "An active user with this email already exists in the tenant",
                    Map.of("email", newEmail, "tenantId", existing.tenantId)
                ));
            }
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(PrincipalItemMapper.ATTR_FIRST_NAME, command.firstName());
        changes.put(PrincipalItemMapper.ATTR_MIDDLE_NAME, command.middleName());
        changes.put(PrincipalItemMapper.ATTR_LAST_NAME, command.lastName());
        changes.put(PrincipalItemMapper.ATTR_EMAIL, newEmail);
        changes.put(PrincipalItemMapper.ATTR_ASSIGNED_ROLE, command.assignedRole());
        changes.put(PrincipalItemMapper.ATTR_ASSIGNED_GROUP, command.assignedGroup());
        changes.put(PrincipalItemMapper.ATTR_START_DATE, command.startDate());
        changes.put(PrincipalItemMapper.ATTR_END_DATE, command.endDate());
        changes.put(PrincipalItemMapper.ATTR_STATUS, command.status() != null ? command.status().value() : null);
        changes.put(PrincipalItemMapper.ATTR_UPDATED_AT, Instant.now().toString());

        Principal updated;
        try {
            updated = principalRepo.updateAttributes(existing.id, changes);
        } catch (StoreException e) {
            LOG.errorf(e, "[%s] Updating user %s failed", context.executionId(), existing.id);
            return Result.failure(new UseCaseError.StoreFailure(
                "STORE_WRITE_FAILED",
                "User could not be updated: " + e.getMessage(),
                Map.of("principalId", existing.id)
            ));
        }

        SideEffectOutcome providerOutcome = syncUpstream(existing, command, context);

        LOG.infof("[%s] Updated user %s", context.executionId(), existing.id);
        return Result.success(new UserUpdated(updated, providerOutcome));
    }

    private SideEffectOutcome syncUpstream(Principal existing, UpdateUserCommand command, ExecutionContext context) {
        if (!identityProvider.isConfigured()) {
            return SideEffectOutcome.skipped("Identity provider not configured");
        }
        Boolean enabled = null;
        if (command.status() != null && command.status() != existing.status) {
            enabled = command.status() == PrincipalStatus.ACTIVE;
        }

        UserProfile profile = UserProfile.builder(existing.email)
            .firstName(command.firstName())
            .lastName(command.lastName())
            .role(command.assignedRole())
            .groupName(command.assignedGroup())
            .enabled(enabled)
            .build();

        try {
            identityProvider.updateUser(profile);
            return new SideEffectOutcome.Updated(existing.email);
        } catch (RuntimeException e) {
            LOG.warnf("[%s] Identity provider update failed for %s: %s",
                context.executionId(), existing.email, e.getMessage());
            return SideEffectOutcome.failed(e);
        }
    }
}
