package tech.accessplane.platform.principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.accessplane.platform.common.ExecutionContext;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.license.LicenseCapacity;
import tech.accessplane.platform.license.LicenseCapacityGate;
import tech.accessplane.platform.principal.operations.assignworkstreams.AssignWorkstreamsCommand;
import tech.accessplane.platform.principal.operations.assignworkstreams.AssignWorkstreamsUseCase;
import tech.accessplane.platform.principal.operations.assignworkstreams.WorkstreamsAssigned;
import tech.accessplane.platform.principal.operations.createuser.CreateUserCommand;
import tech.accessplane.platform.principal.operations.createuser.CreateUserUseCase;
import tech.accessplane.platform.principal.operations.createuser.UserCreated;
import tech.accessplane.platform.principal.operations.deleteuser.DeleteUserCommand;
import tech.accessplane.platform.principal.operations.deleteuser.DeleteUserUseCase;
import tech.accessplane.platform.principal.operations.deleteuser.UserDeleted;
import tech.accessplane.platform.principal.operations.updateuser.UpdateUserCommand;
import tech.accessplane.platform.principal.operations.updateuser.UpdateUserUseCase;
import tech.accessplane.platform.principal.operations.updateuser.UserUpdated;

import java.util.List;
import java.util.Optional;

/**
 * UserOperations - Single point of discovery for the Principal aggregate.
 *
 * <p>All write operations on principals go through this service. Each one:
 * <ul>
 *   <li>Takes a command describing what to do</li>
 *   <li>Takes an execution context for tracing and caller info</li>
 *   <li>Returns a Result containing either the outcome or an error</li>
 * </ul>
 *
 * <p>Read operations do not require execution context.
 */
@ApplicationScoped
public class UserOperations {

    // ========================================================================
    // Write Operations (Use Cases)
    // ========================================================================

    @Inject
    CreateUserUseCase createUserUseCase;

    @Inject
    UpdateUserUseCase updateUserUseCase;

    @Inject
    DeleteUserUseCase deleteUserUseCase;

    @Inject
    AssignWorkstreamsUseCase assignWorkstreamsUseCase;

    /**
     * Create a principal in a tenant, subject to the tenant's license capacity.
     */
    public Result<UserCreated> createUser(CreateUserCommand command, ExecutionContext context) {
        return createUserUseCase.execute(command, context);
    }

    public Result<UserUpdated> updateUser(UpdateUserCommand command, ExecutionContext context) {
        return updateUserUseCase.execute(command, context);
    }

    public Result<UserDeleted> deleteUser(DeleteUserCommand command, ExecutionContext context) {
        return deleteUserUseCase.execute(command, context);
    }

    /**
     * Replace the complete workstream set of a principal.
     */
    public Result<WorkstreamsAssigned> assignWorkstreams(AssignWorkstreamsCommand command, ExecutionContext context) {
        return assignWorkstreamsUseCase.execute(command, context);
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    LicenseCapacityGate capacityGate;

    /**
     * Find a principal by ID, with its workstream ids.
     */
    public Optional<Principal> findById(String id) {
        return principalRepo.findByIdWithWorkstreams(id);
    }

    public List<Principal> findAll() {
        return principalRepo.findAll();
    }

    public List<Principal> findByTenant(String tenantId) {
        return principalRepo.findByTenant(tenantId);
    }

    public List<String> getWorkstreams(String principalId) {
        return principalRepo.findWorkstreamIds(principalId);
    }

    /**
     * Seat usage of a tenant, for display. Does not enforce anything.
     */
    public LicenseCapacity getLicenseCapacity(String tenantId) {
        return capacityGate.getCapacity(tenantId);
    }
}
