package com.example.identityapi.service.result;

import java.util.List;
import java.util.function.Function;

/**
 * Uniform outcome of a service operation.
 *
 * Successful results carry an optional value. Failed results carry the
 * {@link ServiceError} kind and the human-readable messages to return to the client;
 * store failures forward the underlying messages verbatim.
 *
 * @param <T> type of the value produced on success
 */
public record ServiceResult<T>(T value, ServiceError error, List<String> errors) {

    public ServiceResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ServiceResult<Void> success() {
        return new ServiceResult<>(null, null, List.of());
    }

    public static <T> ServiceResult<T> success(T value) {
        return new ServiceResult<>(value, null, List.of());
    }

    public static <T> ServiceResult<T> failure(ServiceError error) {
        return new ServiceResult<>(null, error, List.of(error.getMessage()));
    }

    public static <T> ServiceResult<T> failure(ServiceError error, List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return failure(error);
        }
        return new ServiceResult<>(null, error, errors);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasError(ServiceError candidate) {
        return error == candidate;
    }

    /**
     * Re-type a failure so it can be returned from an operation with another value type.
     */
    public <R> ServiceResult<R> propagateFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot propagate a successful result as a failure");
        }
        return new ServiceResult<>(null, error, errors);
    }

    public <R> ServiceResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return propagateFailure();
        }
        return success(mapper.apply(value));
    }
}
