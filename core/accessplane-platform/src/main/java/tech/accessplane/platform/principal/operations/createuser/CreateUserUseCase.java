package tech.accessplane.platform.principal.operations.createuser;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.common.ExecutionContext;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.common.SideEffectOutcome;
import tech.accessplane.platform.common.UseCase;
import tech.accessplane.platform.common.errors.UseCaseError;
import tech.accessplane.platform.license.LicenseCapacity;
import tech.accessplane.platform.license.LicenseCapacityGate;
import tech.accessplane.platform.notification.NotificationContext;
import tech.accessplane.platform.notification.Recipient;
import tech.accessplane.platform.principal.IdentityProvisioningService;
import tech.accessplane.platform.principal.Principal;
import tech.accessplane.platform.principal.PrincipalRepository;
import tech.accessplane.platform.principal.PrincipalStatus;
import tech.accessplane.platform.principal.mapper.PrincipalItemMapper;
import tech.accessplane.platform.store.KeyValueStore;
import tech.accessplane.platform.store.StoreException;
import tech.accessplane.platform.store.TransactionCancelledException;
import tech.accessplane.platform.store.WriteOperation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Use case for creating a principal.
 *
 * <p>Steps run in a fixed order: validation and the capacity check, then the
 * best-effort identity provider call (and credential email), then one atomic
 * write of the principal and its workstream assignments. A provider failure
 * never blocks the stored record; a principal created upstream whose store
 * write then fails is left for reconciliation to pick up.
 */
@ApplicationScoped
public class CreateUserUseCase implements UseCase<CreateUserCommand, UserCreated> {

    private static final Logger LOG = Logger.getLogger(CreateUserUseCase.class);

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    LicenseCapacityGate capacityGate;

    @Inject
    IdentityProvisioningService provisioning;

    @Inject
    KeyValueStore store;

    @Override
    public Result<UserCreated> execute(CreateUserCommand command, ExecutionContext context) {
        Result<Void> validation = validate(command);
        if (validation.isFailure()) {
            return Result.failure(validation.error());
        }

        String email = command.email().trim();

        // Check if email already exists among the tenant's active principals
        boolean emailTaken = principalRepo.findByTenant(command.tenantId()).stream()
            .anyMatch(p -> p.isActive() && p.hasEmail(email));
        if (emailTaken) {
            return Result.failure(new UseCaseError.ValidationError(
                "EMAIL_EXISTS",
                "An active user with this email already exists in the tenant",
                Map.of("email", email, "tenantId", command.tenantId())
            ));
        }

        if (command.workstreamIds() != null
                && command.workstreamIds().stream().anyMatch(id -> id == null || id.isBlank())) {
            return Result.failure(new UseCaseError.ValidationError(
                "INVALID_WORKSTREAM_ID",
                "Workstream ids must not be blank",
                Map.of()
            ));
        }

        List<String> workstreamIds = command.workstreamIds() == null
            ? List.of()
            : List.copyOf(new LinkedHashSet<>(command.workstreamIds()));
        if (workstreamIds.size() + 1 > KeyValueStore.MAX_TRANSACTION_SIZE) {
            return Result.failure(new UseCaseError.ValidationError(
                "TOO_MANY_WORKSTREAMS",
                "At most " + (KeyValueStore.MAX_TRANSACTION_SIZE - 1) + " workstreams can be assigned",
                Map.of("count", workstreamIds.size())
            ));
        }

        // Capacity gate: nothing is written when the tenant is full
        Result<LicenseCapacity> capacity = capacityGate.validateUserCreation(command.tenantId());
        if (capacity.isFailure()) {
            return Result.failure(capacity.error());
        }

        Principal principal = new Principal();
        principal.id = UUID.randomUUID().toString();
        principal.tenantId = command.tenantId();
        principal.enterpriseId = command.enterpriseId();
        principal.firstName = command.firstName();
        principal.middleName = command.middleName();
        principal.lastName = command.lastName();
        principal.email = email;
        principal.assignedRole = command.assignedRole();
        principal.assignedGroup = command.assignedGroup();
        principal.startDate = command.startDate();
        principal.endDate = command.endDate();
        principal.status = PrincipalStatus.ACTIVE;
        principal.technicalUser = Boolean.TRUE.equals(command.technicalUser());

        // Best-effort: identity provider, then credential email
        IdentityProvisioningService.Attempt attempt = provisioning.provision(IdentityProvisioningService.profileOf(principal));
        principal.externalSubjectId = attempt.externalSubjectId();
        SideEffectOutcome notification = provisioning.notifyCredentials(
            attempt,
            new Recipient(principal.email, principal.firstName, principal.lastName),
            new NotificationContext(principal.tenantId, command.tenantName(), principal.id)
        );

        Instant now = Instant.now();
        principal.createdAt = now;
        principal.updatedAt = now;
        principal.workstreamIds = workstreamIds;

        List<WriteOperation> operations = new ArrayList<>();
        operations.add(WriteOperation.putIfAbsent(PrincipalItemMapper.toItem(principal)));
        for (String workstreamId : workstreamIds) {
            operations.add(WriteOperation.put(PrincipalItemMapper.toWorkstreamItem(principal.id, workstreamId, now)));
        }

        try {
            store.transactWrite(operations);
        } catch (TransactionCancelledException e) {
            LOG.errorf("[%s] Creating user %s was cancelled: %s", context.executionId(), email, e.reasons());
            return Result.failure(new UseCaseError.StoreFailure(
                "TRANSACTION_CANCELLED",
                "User could not be created: " + e.getMessage(),
                Map.of("email", email, "reasons", e.reasons())
            ));
        } catch (StoreException e) {
            LOG.errorf(e, "[%s] Creating user %s failed", context.executionId(), email);
            return Result.failure(new UseCaseError.StoreFailure(
                "STORE_WRITE_FAILED",
                "User could not be created: " + e.getMessage(),
                Map.of("email", email)
            ));
        }

        LOG.infof("[%s] Created user %s (%s) in tenant %s with %d workstreams",
            context.executionId(), principal.id, email, principal.tenantId, workstreamIds.size());

        return Result.success(new UserCreated(
            principal,
            capacity.value().afterCreation(),
            attempt.outcome(),
            notification
        ));
    }

    private Result<Void> validate(CreateUserCommand command) {
        if (command.tenantId() == null || command.tenantId().isBlank()) {
            return required("TENANT_REQUIRED", "Tenant is required");
        }
        if (command.email() == null || command.email().isBlank()) {
            return required("EMAIL_REQUIRED", "Email is required");
        }
        if (!isValidEmail(command.email().trim())) {
            return Result.failure(new UseCaseError.ValidationError(
                "INVALID_EMAIL",
                "Invalid email format",
                Map.of("email", command.email())
            ));
        }
        if (command.firstName() == null || command.firstName().isBlank()) {
            return required("FIRST_NAME_REQUIRED", "First name is required");
        }
        if (command.lastName() == null || command.lastName().isBlank()) {
            return required("LAST_NAME_REQUIRED", "Last name is required");
        }
        return Result.success(null);
    }

    private static Result<Void> required(String code, String message) {
        return Result.failure(new UseCaseError.ValidationError(code, message, Map.of()));
    }

    private boolean isValidEmail(String email) {
        return email.contains("@") && email.indexOf("@") > 0
            && email.indexOf("@") < email.length() - 1;
    }
}
