package tech.accessplane.platform.common;

import tech.accessplane.platform.common.errors.UseCaseError;


/**
 * Result type for use case execution.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Only the failures listed in {@link UseCaseError} ever reach a caller as a
 * failed operation. Identity-provider and notification problems are reported
 * inside the success value instead.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException if this is a failure
     */
    default T value() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        throw new IllegalStateException("Result is a failure: " + ((Failure<T>) this).error().code());
    }

    /**
     * Error of a failed result.
     *
     * @throws IllegalStateException if this is a success
     */
    default UseCaseError error() {
        if (this instanceof Failure<T> f) {
            return f.error();
        }
        throw new IllegalStateException("Result is a success");
    }
}
