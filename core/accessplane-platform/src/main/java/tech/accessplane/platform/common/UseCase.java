package tech.accessplane.platform.common;

/**
 * Base interface for all use cases.
 *
 * <p>A use case takes a command describing what to do and an execution context
 * for tracing, and returns a {@link Result}. Validation and business rule
 * failures are returned, never thrown.
 *
 * <p>Implementation example:
 * <pre>{@code
 * @ApplicationScoped
 * public class DeleteUserUseCase implements UseCase<DeleteUserCommand, UserDeleted> {
 *
 *     @Override
 *     public Result<UserDeleted> execute(DeleteUserCommand command, ExecutionContext context) {
 *         // Business logic here
 *     }
 * }
 * }</pre>
 *
 * @param <C> The command type
 * @param <R> The result value type
 */
public interface UseCase<C, R> {

    /**
     * Execute the use case.
     *
     * @param command The command to execute
     * @param context The execution context with tracing and caller info
     * @return Success with the outcome, or Failure with error
     */
    Result<R> execute(C command, ExecutionContext context);
}
