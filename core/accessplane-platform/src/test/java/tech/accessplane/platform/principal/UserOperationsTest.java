package tech.accessplane.platform.principal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.accessplane.platform.common.ExecutionContext;
import tech.accessplane.platform.common.Result;
import tech.accessplane.platform.license.LicenseCapacity;
import tech.accessplane.platform.license.LicenseCapacityGate;
import tech.accessplane.platform.principal.operations.assignworkstreams.AssignWorkstreamsCommand;
import tech.accessplane.platform.principal.operations.assignworkstreams.AssignWorkstreamsUseCase;
import tech.accessplane.platform.principal.operations.assignworkstreams.WorkstreamsAssigned;
import tech.accessplane.platform.principal.operations.createuser.CreateUserUseCase;
import tech.accessplane.platform.principal.operations.deleteuser.DeleteUserCommand;
import tech.accessplane.platform.principal.operations.deleteuser.DeleteUserUseCase;
import tech.accessplane.platform.principal.operations.updateuser.UpdateUserUseCase;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * UserOperations delegates to the use cases and the repository.
 */
@ExtendWith(MockitoExtension.class)
class UserOperationsTest {

    @Mock
    private CreateUserUseCase createUserUseCase;

    @Mock
    private UpdateUserUseCase updateUserUseCase;

    @Mock
    private DeleteUserUseCase deleteUserUseCase;

    @Mock
    private AssignWorkstreamsUseCase assignWorkstreamsUseCase;

    @Mock
    private PrincipalRepository principalRepo;

    @Mock
    private LicenseCapacityGate capacityGate;

    @InjectMocks
    private UserOperations operations;

    private final ExecutionContext context = ExecutionContext.create("admin@acme.com");

    @Test
    @DisplayName("assignWorkstreams should delegate to its use case")
    void assignWorkstreams_shouldDelegate() {
        AssignWorkstreamsCommand command = new AssignWorkstreamsCommand("p1", List.of("ws-a"));
        Result<WorkstreamsAssigned> expected = Result.success(
            new WorkstreamsAssigned("p1", List.of("ws-a"), List.of("ws-a"), List.of()));
        when(assignWorkstreamsUseCase.execute(command, context)).thenReturn(expected);

        assertThat(operations.assignWorkstreams(command, context)).isSameAs(expected);
        verifyNoInteractions(createUserUseCase, updateUserUseCase, deleteUserUseCase);
    }

    @Test
    @DisplayName("deleteUser should delegate to its use case")
    void deleteUser_shouldDelegate() {
        DeleteUserCommand command = new DeleteUserCommand("p1");

        operations.deleteUser(command, context);

        verify(deleteUserUseCase).execute(command, context);
    }

    @Test
    @DisplayName("findById should include the workstream ids")
    void findById_shouldIncludeWorkstreams() {
        Principal principal = PrincipalFixtures.principal("p1", "t1", "ada@acme.com");
        principal.workstreamIds = List.of("ws-a");
        when(principalRepo.findByIdWithWorkstreams("p1")).thenReturn(Optional.of(principal));

        assertThat(operations.findById("p1")).get()
            .extracting(p -> p.workstreamIds)
            .isEqualTo(List.of("ws-a"));
    }

    @Test
    @DisplayName("getLicenseCapacity should report capacity without enforcing it")
    void getLicenseCapacity_shouldNotEnforce() {
        when(capacityGate.getCapacity("t1")).thenReturn(new LicenseCapacity(5, 5, 0));

        assertThat(operations.getLicenseCapacity("t1").isExhausted()).isTrue();
        verify(capacityGate, never()).validateUserCreation("t1");
    }
}
