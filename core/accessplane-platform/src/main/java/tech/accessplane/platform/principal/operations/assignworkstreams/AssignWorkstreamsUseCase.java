package tech.accessplane.platform.principal.operations.assignworkstreams;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.common.ExecutionContext;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.common.UseCase;
import tech.accessplane.platform.common.errors.UseCaseError;
import tech.accessplane.platform.principal.PrincipalRepository;
import tech.accessplane.platform.principal.mapper.PrincipalItemMapper;
import tech.accessplane.platform.store.ItemKey;
import tech.accessplane.platform.store.KeySpace;
import tech.accessplane.platform.store.KeyValueStore;
import tech.accessplane.platform.store.StoreException;
import tech.accessplane.platform.store.WriteOperation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Use case for replacing a principal's workstream set.
 *
 * <p>The set is always replaced as a whole, in one transaction: assignments
 * not in the new set are deleted and every assignment of the new set is
 * written. A transaction may not touch the same key twice, so a kept
 * assignment is rewritten rather than deleted and re-added.
 */
@ApplicationScoped
public class AssignWorkstreamsUseCase implements UseCase<AssignWorkstreamsCommand, WorkstreamsAssigned> {

    private static final Logger LOG = Logger.getLogger(AssignWorkstreamsUseCase.class);

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    KeyValueStore store;

    @Override
    public Result<WorkstreamsAssigned> execute(AssignWorkstreamsCommand command, ExecutionContext context) {
        if (command.workstreamIds() != null
                && command.workstreamIds().stream().anyMatch(id -> id == null || id.isBlank())) {
            return Result.failure(new UseCaseError.ValidationError(
                "INVALID_WORKSTREAM_ID",
                "Workstream ids must not be blank",
                Map.of()
            ));
        }

        if (principalRepo.findById(command.principalId()).isEmpty()) {
            return Result.failure(new UseCaseError.NotFoundError(
                "USER_NOT_FOUND",
                "User not found",
                Map.of("principalId", String.valueOf(command.principalId()))
            ));
        }

        Set<String> target = command.workstreamIds() == null
            ? Set.of()
            : new LinkedHashSet<>(command.workstreamIds());
        List<String> current = principalRepo.findWorkstreamIds(command.principalId());

        List<String> removed = current.stream().filter(id -> !target.contains(id)).toList();
        List<String> added = target.stream().filter(id -> !current.contains(id)).toList();

        List<WriteOperation> operations = new ArrayList<>();
        for (String workstreamId : removed) {
            operations.add(WriteOperation.delete(
                new ItemKey(KeySpace.user(command.principalId()), KeySpace.workstream(workstreamId))));
        }
        Instant now = Instant.now();
        for (String workstreamId : target) {
            operations.add(WriteOperation.put(
                PrincipalItemMapper.toWorkstreamItem(command.principalId(), workstreamId, now)));
        }

        if (operations.size() > KeyValueStore.MAX_TRANSACTION_SIZE) {
            return Result.failure(new UseCaseError.ValidationError(
                "TOO_MANY_WORKSTREAMS",
                "Workstream change exceeds " + KeyValueStore.MAX_TRANSACTION_SIZE + " operations",
                Map.of("operations", operations.size())
            ));
        }

        if (!operations.isEmpty()) {
            try {
                store.transactWrite(operations);
            } catch (StoreException e) {
                LOG.errorf(e, "[%s] Replacing workstreams of %s failed", context.executionId(), command.principalId());
                return Result.failure(new UseCaseError.StoreFailure(
                    "STORE_WRITE_FAILED",
                    "Workstreams could not be updated: " + e.getMessage(),
                    Map.of("principalId", command.principalId())
                ));
            }
        }

        LOG.infof("[%s] Workstreams of %s replaced: %d added, %d removed",
            context.executionId(), command.principalId(), added.size(), removed.size());
        return Result.success(new WorkstreamsAssigned(command.principalId(), List.copyOf(target), added, removed));
    }
}
