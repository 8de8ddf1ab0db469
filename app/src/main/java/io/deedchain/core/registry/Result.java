package io.deedchain.core.registry;

import java.util.Objects;

/**
 * Outcome of a registry operation: a value or one error kind.
 */
public final class Result<T> {
    private final T value;
    private final RegistryError error;

    private Result(T value, RegistryError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> error(RegistryError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    /** The value; fails if this is an error result. */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value, result is " + this);
        }
        return value;
    }

    /** The error kind, or null for a successful result. */
    public RegistryError error() {
        return error;
    }

    public T orElseThrow() {
        if (error != null) {
            throw new RegistryException(error, "operation failed");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Result)) return false;
        Result<?> other = (Result<?>) o;
        return Objects.equals(value, other.value) && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "OK(" + value + ")" : "ERR[" + error.code() + " " + error + "]";
    }
}
