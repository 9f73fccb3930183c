package tech.accessplane.platform.principal.operations.deleteuser;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accessplane.platform.common.ExecutionContext;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.common.SideEffectOutcome;
import tech.accessplane.platform.common.UseCase;
import tech.accessplane.platform.common.errors.UseCaseError;
import tech.accessplane.platform.identity.IdentityProviderAdapter;
import tech.accessplane.platform.principal.PrincipalRepository;
import tech.accessplane.platform.principal.mapper.PrincipalItemMapper;
import tech.accessplane.platform.store.BatchWriteException;
import tech.accessplane.platform.store.Item;
import tech.accessplane.platform.store.KeySpace;
import tech.accessplane.platform.store.KeyValueStore;
import tech.accessplane.platform.store.StoreException;
import tech.accessplane.platform.store.WriteOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Use case for deleting a principal.
 *
 * <p>Deletes the upstream identity (best-effort), then every item of the
 * principal's partition in chunked batch writes. Batches are not atomic:
 * the metadata item is deleted last, so after a partial failure the principal
 * is still found and running the delete again removes what is left.
 */
@ApplicationScoped
public class DeleteUserUseCase implements UseCase<DeleteUserCommand, UserDeleted> {

    private static final Logger LOG = Logger.getLogger(DeleteUserUseCase.class);

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    IdentityProviderAdapter identityProvider;

    @Inject
    KeyValueStore store;

    @Override
    public Result<UserDeleted> execute(DeleteUserCommand command, ExecutionContext context) {
        List<Item> items = principalRepo.findPartitionItems(command.principalId());
        if (items.isEmpty()) {
            return Result.failure(new UseCaseError.NotFoundError(
                "USER_NOT_FOUND",
                "User not found",
                Map.of("principalId", String.valueOf(command.principalId()))
            ));
        }

        Item metadata = items.stream()
            .filter(item -> KeySpace.METADATA.equals(item.getString(KeySpace.SK)))
            .findFirst()
            .orElse(null);
        String email = metadata != null ? metadata.getString(PrincipalItemMapper.ATTR_EMAIL) : null;

        SideEffectOutcome providerOutcome;
        if (email == null) {
            providerOutcome = SideEffectOutcome.skipped("No email on record");
        } else {
            try {
                providerOutcome = identityProvider.deleteUser(email).toOutcome(email);
            } catch (RuntimeException e) {
                LOG.warnf("[%s] Identity provider delete failed for %s: %s",
                    context.executionId(), email, e.getMessage());
                providerOutcome = SideEffectOutcome.failed(e);
            }
        }

        List<WriteOperation> deletes = new ArrayList<>();
        for (Item item : items) {
            if (item != metadata) {
                deletes.add(WriteOperation.delete(item.key()));
            }
        }
        if (metadata != null) {
            deletes.add(WriteOperation.delete(metadata.key()));
        }

        int deleted;
        try {
            deleted = store.batchWrite(deletes);
        } catch (BatchWriteException e) {
            LOG.errorf("[%s] Deleting user %s stopped after %d of %d items: %s",
                context.executionId(), command.principalId(), e.appliedOperations(), deletes.size(), e.getMessage());
            return Result.failure(new UseCaseError.StoreFailure(
                "PARTIAL_DELETE",
                "User was only partly deleted; retry the delete to remove the remaining items",
                Map.of(
                    "principalId", command.principalId(),
                    "deleted", e.appliedOperations(),
                    "total", deletes.size()
                )
            ));
        } catch (StoreException e) {
            LOG.errorf(e, "[%s] Deleting user %s failed", context.executionId(), command.principalId());
            return Result.failure(new UseCaseError.StoreFailure(
                "STORE_WRITE_FAILED",
                "User could not be deleted: " + e.getMessage(),
                Map.of("principalId", command.principalId())
            ));
        }

        LOG.infof("[%s] Deleted user %s (%d items)", context.executionId(), command.principalId(), deleted);
        return Result.success(new UserDeleted(command.principalId(), email, deleted, providerOutcome));
    }
}
