package uk.gegc.intellicode.shared.result;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation whose failures are part of its contract.
 * Exactly one of {@link #getValue()} and {@link #getError()} is available.
 *
 * @param <T> success value type
 * @param <E> error type, usually an enum describing the expected failure
 */
public final class Result<T, E> {

    private final T value;
    private final E error;

    private Result(T value, E error) {
        this.value = value;
        this.error = error;
    }

    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(value, null);
    }

    public static <T, E> Result<T, E> err(E error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isErr() {
        return error != null;
    }

    public T getValue() {
        if (isErr()) {
            throw new NoSuchElementException("Result is an error: " + error);
        }
        return value;
    }

    public E getError() {
        if (isOk()) {
            throw new NoSuchElementException("Result is not an error");
        }
        return error;
    }

    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        return isOk() ? ok(mapper.apply(value)) : err(error);
    }

    public <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        return isOk() ? mapper.apply(value) : err(error);
    }

    /**
     * Returns the value or throws the exception produced from the error.
     */
    public <X extends RuntimeException> T orElseThrow(Function<? super E, X> exceptionMapper) {
        if (isErr()) {
            throw exceptionMapper.apply(error);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Result<?, ?> other)) return false;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + value + "]" : "Err[" + error + "]";
    }
}
