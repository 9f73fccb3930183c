package tech.accessplane.platform.principal.operations.assignworkstreams;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.accessplane.platform.common.ExecutionContext;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.common.errors.UseCaseError;
import tech.accessplane.platform.principal.KeyValuePrincipalRepository;
import tech.accessplane.platform.principal.mapper.PrincipalItemMapper;
import tech.accessplane.platform.store.InMemoryKeyValueStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static tech.accessplane.platform.principal.PrincipalFixtures.*;

/**
 * Unit tests for AssignWorkstreamsUseCase over the in-memory store.
 */
class AssignWorkstreamsUseCaseTest {

    private InMemoryKeyValueStore store;
    private KeyValuePrincipalRepository principalRepo;
    private AssignWorkstreamsUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("admin@acme.com");

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        principalRepo = repositoryOver(store);
        useCase = new AssignWorkstreamsUseCase();
        useCase.principalRepo = principalRepo;
        useCase.store = store;
        save(store, principal("p1", "t1", "ada@acme.com"));
    }

    @Test
    @DisplayName("execute should replace the workstream set as a whole")
    void execute_shouldReplaceWholeSet() {
        // Arrange
        store.put(PrincipalItemMapper.toWorkstreamItem("p1", "ws-a", Instant.now()));
        store.put(PrincipalItemMapper.toWorkstreamItem("p1", "ws-b", Instant.now()));

        // Act
        Result<WorkstreamsAssigned> result = useCase.execute(
            new AssignWorkstreamsCommand("p1", List.of("ws-b", "ws-c", "ws-c")), context);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().workstreamIds()).containsExactly("ws-b", "ws-c");
        assertThat(result.value().added()).containsExactly("ws-c");
        assertThat(result.value().removed()).containsExactly("ws-a");
        assertThat(principalRepo.findWorkstreamIds("p1")).containsExactly("ws-b", "ws-c");
        assertThat(principalRepo.findById("p1")).isPresent();
    }

    @Test
    @DisplayName("execute should remove every assignment for an empty set")
    void execute_shouldRemoveAll_forEmptySet() {
        // Arrange
        store.put(PrincipalItemMapper.toWorkstreamItem("p1", "ws-a", Instant.now()));

        // Act
        Result<WorkstreamsAssigned> result = useCase.execute(new AssignWorkstreamsCommand("p1", List.of()), context);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(principalRepo.findWorkstreamIds("p1")).isEmpty();
    }

    @Test
    @DisplayName("execute should leave the set unchanged when the change is too large for one transaction")
    void execute_shouldLeaveSetUnchanged_whenTooLarge() {
        // Arrange
        store.put(PrincipalItemMapper.toWorkstreamItem("p1", "ws-a", Instant.now()));
        List<String> many = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            many.add("ws-" + i);
        }

        // Act
        Result<WorkstreamsAssigned> result = useCase.execute(new AssignWorkstreamsCommand("p1", many), context);

        // Assert
        assertThat(result.error()).isInstanceOf(UseCaseError.ValidationError.class);
        assertThat(principalRepo.findWorkstreamIds("p1")).containsExactly("ws-a");
    }

    @Test
    @DisplayName("execute should reject blank workstream ids and leave the set unchanged")
    void execute_shouldRejectBlankIds() {
        // Arrange
        store.put(PrincipalItemMapper.toWorkstreamItem("p1", "ws-a", Instant.now()));

        // Act
        Result<WorkstreamsAssigned> blank = useCase.execute(
            new AssignWorkstreamsCommand("p1", List.of("ws-b", "  ")), context);
        Result<WorkstreamsAssigned> nullId = useCase.execute(
            new AssignWorkstreamsCommand("p1", Arrays.asList("ws-b", null)), context);

        // Assert
        assertThat(blank.error()).isInstanceOf(UseCaseError.ValidationError.class);
        assertThat(blank.error().code()).isEqualTo("INVALID_WORKSTREAM_ID");
        assertThat(nullId.error().code()).isEqualTo("INVALID_WORKSTREAM_ID");
        assertThat(principalRepo.findWorkstreamIds("p1")).containsExactly("ws-a");
    }

    @Test
    @DisplayName("execute should fail with NotFound for an unknown principal")
    void execute_shouldFail_whenPrincipalMissing() {
        Result<WorkstreamsAssigned> result = useCase.execute(
            new AssignWorkstreamsCommand("missing", List.of("ws-a")), context);

        assertThat(result.error()).isInstanceOf(UseCaseError.NotFoundError.class);
        assertThat(store.size()).isEqualTo(1);
    }
}
