package com.planwright.core.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation whose failure is an expected case (missing plan, missing
 * task, illegal transition) rather than an error. Callers must check {@link #isOk()}.
 *
 * @param value   the value when successful, otherwise null
 * @param error   failure kind, null when successful
 * @param message failure detail, null when successful
 */
public record Result<T>(T value, ErrorKind error, String message) {

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Result<T> failure(ErrorKind error, String message) {
        return new Result<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isOk() {
        return error == null;
    }

    public <U> Result<U> map(Function<T, U> fn) {
        return isOk() ? Result.ok(fn.apply(value)) : Result.failure(error, message);
    }

    /** Re-types a failed result; must not be called on a successful one. */
    public <U> Result<U> propagate() {
        if (isOk()) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return Result.failure(error, message);
    }

    /**
     * Returns the value or throws {@link IllegalStateException} naming the failure.
     */
    public T orElseThrow() {
        if (!isOk()) {
            throw new IllegalStateException(error + ": " + message);
        }
        return value;
    }
}
