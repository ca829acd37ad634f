package com.epcid.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tagged outcome of an engine operation: either a value or an {@link EngineError}
 * with a human-readable message. Never both, never neither.
 */
public final class EngineResult<T> {

    private final T value;
    private final EngineError error;
    private final String message;

    private EngineResult(T value, EngineError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> EngineResult<T> ok(T value) {
        Objects.requireNonNull(value, "value");
        return new EngineResult<>(value, null, null);
    }

    public static <T> EngineResult<T> failure(EngineError error, String message) {
        Objects.requireNonNull(error, "error");
        return new EngineResult<>(null, error, message);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean hasError(EngineError candidate) {
        return error == candidate;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * @throws IllegalStateException when this result carries an error
     */
    public T orElseThrow() {
        if (error != null) {
            throw new IllegalStateException(error + ": " + message);
        }
        return value;
    }

    public Optional<EngineError> getError() {
        return Optional.ofNullable(error);
    }

    public String getMessage() {
        return message;
    }

    public <R> EngineResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error, message);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EngineResult<?> other)) return false;
        return Objects.equals(value, other.value)
            && error == other.error
            && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error, message);
    }

    @Override
    public String toString() {
        return isOk() ? "EngineResult[ok=" + value + "]" : "EngineResult[" + error + ": " + message + "]";
    }
}
