package com.adaptiv.healthservice.exceptions;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.util.function.Function;

/**
 * Result of a policy-bearing operation: either a value or an {@link ErrorCode}.
 * Policy denials travel through this type; storage and other infrastructure
 * failures are still thrown and handled by {@link GlobalExceptionHandler}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Outcome<T> {

    private final T value;
    private final ErrorCode error;
    private final String message;
    private final Duration retryAfter;

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null, null, null);
    }

    public static <T> Outcome<T> failure(ErrorCode error) {
        return new Outcome<>(null, error, error.getDefaultMessage(), null);
    }

    public static <T> Outcome<T> failure(ErrorCode error, String message) {
        return new Outcome<>(null, error, message, null);
    }

    public static <T> Outcome<T> locked(Duration retryAfter) {
        return new Outcome<>(null, ErrorCode.ACCOUNT_LOCKED, ErrorCode.ACCOUNT_LOCKED.getDefaultMessage(), retryAfter);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return propagate();
        }
        return success(mapper.apply(value));
    }

    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        if (isFailure()) {
            return propagate();
        }
        return mapper.apply(value);
    }

    /**
     * Re-types a failure so it can be returned from an operation with a different success type.
     */
    public <R> Outcome<R> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot propagate a successful outcome");
        }
        return new Outcome<>(null, error, message, retryAfter);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome[success]" : "Outcome[" + error + ": " + message + "]";
    }
}
