package com.wildfire.resolution.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a boundary operation: either a value or a {@link ServiceError}.
 *
 * @param <T> value type
 */
public final class Result<T> {

    private final T value;
    private final ServiceError error;

    private Result(T value, ServiceError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(ServiceError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error is required"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the value.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present: " + error);
        }
        return value;
    }

    /**
     * Returns the error.
     *
     * @throws IllegalStateException if this result is a success
     */
    public ServiceError getError() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Result<?> other)) return false;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Success(" + value + ")" : "Failure(" + error + ")";
    }
}
