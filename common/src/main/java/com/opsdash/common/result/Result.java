package com.opsdash.common.result;

import com.opsdash.common.exception.OpsDashException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an inbox or registry operation: data, an error, or both.
 *
 * Both are present only for partial outcomes such as a broadcast where some
 * recipients failed; callers can keep the data and still react to the error.
 */
public final class Result<T> {

    private final T data;
    private final OpsDashException error;

    private Result(T data, OpsDashException error) {
        this.data = data;
        this.error = error;
    }

    public static <T> Result<T> ok(T data) {
        return new Result<>(data, null);
    }

    public static <T> Result<T> failure(OpsDashException error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> Result<T> partial(T data, OpsDashException error) {
        return new Result<>(data, Objects.requireNonNull(error, "error"));
    }

    public T getData() {
        return data;
    }

    public OpsDashException getError() {
        return error;
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public Optional<T> data() {
        return Optional.ofNullable(data);
    }

    public Optional<OpsDashException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the data, or {@code fallback} when this is a failure without data.
     */
    public T orElse(T fallback) {
        return data != null ? data : fallback;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        R mapped = data != null ? mapper.apply(data) : null;
        return new Result<>(mapped, error);
    }

    @Override
    public String toString() {
        return isOk()
                ? "Result[ok, data=" + data + "]"
                : "Result[error=" + error.getErrorCode() + ": " + error.getMessage() + ", data=" + data + "]";
    }
}
