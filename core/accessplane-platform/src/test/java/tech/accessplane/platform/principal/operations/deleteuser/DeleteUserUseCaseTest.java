package tech.accessplane.platform.principal.operations.deleteuser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.accessplane.platform.common.ExecutionContext;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.common.SideEffectOutcome;
import tech.accessplane.platform.common.errors.UseCaseError;
import tech.accessplane.platform.identity.DeprovisionResult;
import tech.accessplane.platform.identity.IdentityProviderAdapter;
import tech.accessplane.platform.identity.IdentityProviderUnavailableException;
import tech.accessplane.platform.principal.PrincipalRepository;
import tech.accessplane.platform.principal.mapper.PrincipalItemMapper;
import tech.accessplane.platform.store.BatchWriteException;
import tech.accessplane.platform.store.InMemoryKeyValueStore;
import tech.accessplane.platform.store.KeyValueStore;
import tech.accessplane.platform.store.WriteOperation;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static tech.accessplane.platform.principal.PrincipalFixtures.*;

/**
 * Unit tests for DeleteUserUseCase.
 */
@ExtendWith(MockitoExtension.class)
class DeleteUserUseCaseTest {

    @Spy
    private InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    @Mock
    private IdentityProviderAdapter identityProvider;

    private PrincipalRepository principalRepo;

    @InjectMocks
    private DeleteUserUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("admin@acme.com");

    @BeforeEach
    void setUp() {
        principalRepo = repositoryOver(store);
        useCase.principalRepo = principalRepo;
    }

    @Test
    @DisplayName("execute should delete every item of the partition with the metadata last")
    void execute_shouldDeleteEveryItem_metadataLast() {
        // Arrange
        save(store, principal("p1", "t1", "ada@acme.com"));
        for (int i = 0; i < 30; i++) {
            store.put(PrincipalItemMapper.toWorkstreamItem("p1", "ws-" + i, Instant.now()));
        }
        save(store, principal("p2", "t1", "grace@acme.com"));
        when(identityProvider.deleteUser("ada@acme.com")).thenReturn(DeprovisionResult.removed());

        // Act
        Result<UserDeleted> result = useCase.execute(new DeleteUserCommand("p1"), context);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().itemsDeleted()).isEqualTo(31);
        assertThat(result.value().email()).isEqualTo("ada@acme.com");
        assertThat(result.value().identityProvider()).isEqualTo(new SideEffectOutcome.Deleted("ada@acme.com"));
        assertThat(principalRepo.findPartitionItems("p1")).isEmpty();
        assertThat(principalRepo.findById("p2")).isPresent();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<WriteOperation>> captor = ArgumentCaptor.forClass(List.class);
        verify(store).batchWrite(captor.capture());
        List<WriteOperation> deletes = captor.getValue();
        assertThat(deletes.get(deletes.size() - 1).key().sortKey()).isEqualTo("METADATA");
        assertThat(deletes.size()).isGreaterThan(KeyValueStore.MAX_BATCH_SIZE);
    }

    @Test
    @DisplayName("execute should still delete locally when the identity provider is unavailable")
    void execute_shouldDeleteLocally_whenIdentityProviderUnavailable() {
        // Arrange
        save(store, principal("p1", "t1", "ada@acme.com"));
        when(identityProvider.deleteUser(anyString()))
            .thenThrow(new IdentityProviderUnavailableException("timeout", new RuntimeException("timeout")));

        // Act
        Result<UserDeleted> result = useCase.execute(new DeleteUserCommand("p1"), context);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().identityProvider().isFailure()).isTrue();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("execute should still delete locally when the identity provider throws an unexpected exception")
    void execute_shouldDeleteLocally_whenIdentityProviderThrowsUnexpectedly() {
        // Arrange
        save(store, principal("p1", "t1", "ada@acme.com"));
        store.put(PrincipalItemMapper.toWorkstreamItem("p1", "ws-a", Instant.now()));
        when(identityProvider.deleteUser("ada@acme.com")).thenThrow(new IllegalStateException("boom"));

        // Act
        Result<UserDeleted> result = useCase.execute(new DeleteUserCommand("p1"), context);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().itemsDeleted()).isEqualTo(2);
        assertThat(result.value().identityProvider()).isEqualTo(new SideEffectOutcome.Failed("boom"));
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("execute should fail with NotFound when the partition is empty")
    void execute_shouldFail_whenPrincipalMissing() {
        // Act
        Result<UserDeleted> result = useCase.execute(new DeleteUserCommand("missing"), context);

        // Assert
        assertThat(result.error()).isInstanceOf(UseCaseError.NotFoundError.class);
        verifyNoInteractions(identityProvider);
    }

    @Test
    @DisplayName("execute should report a partial delete and succeed when re-run")
    void execute_shouldReportPartialDelete_andSucceedOnRerun() {
        // Arrange
        save(store, principal("p1", "t1", "ada@acme.com"));
        store.put(PrincipalItemMapper.toWorkstreamItem("p1", "ws-a", Instant.now()));
        when(identityProvider.deleteUser("ada@acme.com"))
            .thenReturn(DeprovisionResult.removed())
            .thenReturn(DeprovisionResult.skipped("User not found in identity provider"));
        doThrow(new BatchWriteException("Batch write failed after 0 operations", 0))
            .doCallRealMethod()
            .when(store).batchWrite(anyList());

        // Act
        Result<UserDeleted> first = useCase.execute(new DeleteUserCommand("p1"), context);
        Result<UserDeleted> second = useCase.execute(new DeleteUserCommand("p1"), context);

        // Assert
        assertThat(first.error().code()).isEqualTo("PARTIAL_DELETE");
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.value().itemsDeleted()).isEqualTo(2);
        assertThat(store.size()).isZero();
    }
}
