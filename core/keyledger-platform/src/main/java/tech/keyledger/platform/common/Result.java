package tech.keyledger.platform.common;

import tech.keyledger.platform.common.errors.LicensingError;

/**
 * Result type for engine operations.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the business outcome that denied the request</li>
 * </ul>
 *
 * <p>Expected business outcomes (unknown key, expired license, capacity reached) travel
 * as {@link Failure}. Infrastructure failures are thrown instead, see
 * {@link TransientStorageException}.
 *
 * <p>Usage in the API layer:
 * <pre>{@code
 * Result<ActivationReceipt> result = engine.activate(key, domain, ip, userAgent);
 * if (result instanceof Result.Success<ActivationReceipt> s) {
 *     return Response.ok(ActivationResponse.from(s.value())).build();
 * }
 * return LicensingErrorResponses.toResponse(((Result.Failure<ActivationReceipt>) result).error());
 * }</pre>
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
    record Failure<T>(LicensingError error) implements Result<T> {
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

    static <T> Result<T> failure(LicensingError error) {
        return new Failure<>(error);
    }

    /**
     * Re-type a failure so it can be returned from an operation with a different value type.
     *
     * @throws IllegalStateException if this result is a success
     */
    default <U> Result<U> propagateFailure() {
        if (this instanceof Failure<T> f) {
            return new Failure<>(f.error());
        }
        throw new IllegalStateException("Cannot propagate a successful result as a failure");
    }
}
