package io.gridmesh.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of every operation that crosses a component or process boundary.
 *
 * <p>Exactly one of a payload or a {@link Failure} is present. Callers inspect {@link #isOk()}
 * before touching {@link #value()}; reading the value of a failed result is a programming error
 * and throws {@link IllegalStateException}. A success may carry a {@code null} payload
 * (operations with nothing to return, or an explicit empty answer).
 */
public final class Result<T> {
    private static final Result<Void> OK_EMPTY = new Result<>(null, null);

    private final T value;
    private final Failure failure;

    private Result(T value, Failure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static Result<Void> ok() {
        return OK_EMPTY;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> fail(ErrorCode code, String message) {
        return new Result<>(null, Failure.of(code, message));
    }

    public static <T> Result<T> fail(Failure failure) {
        return new Result<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isOk() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    public T value() {
        if (failure != null) {
            throw new IllegalStateException("value() called on failed result: " + failure);
        }
        return value;
    }

    public Failure failure() {
        if (failure == null) {
            throw new IllegalStateException("failure() called on successful result");
        }
        return failure;
    }

    public ErrorCode code() {
        return failure == null ? null : failure.code();
    }

    public boolean hasCode(ErrorCode code) {
        return failure != null && failure.code() == code;
    }

    public Optional<T> toOptional() {
        return failure == null ? Optional.ofNullable(value) : Optional.empty();
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (failure != null) {
            return new Result<>(null, failure);
        }
        return new Result<>(mapper.apply(value), null);
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (failure != null) {
            return new Result<>(null, failure);
        }
        return Objects.requireNonNull(mapper.apply(value), "flatMap mapper returned null");
    }

    // Re-types a failure for a caller with a different payload type; the failure is unchanged.
    public <U> Result<U> asFailure() {
        if (failure == null) {
            throw new IllegalStateException("asFailure() called on successful result");
        }
        return new Result<>(null, failure);
    }

    public <U> Result<U> propagate(String context) {
        Failure current = failure();
        return new Result<>(null, new Failure(current.code(), context, current));
    }

    public <U> Result<U> translate(ErrorCode code, String message) {
        Failure current = failure();
        return new Result<>(null, new Failure(code, message, current));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value) && Objects.equals(failure, other.failure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, failure);
    }

    @Override
    public String toString() {
        return failure == null ? "Ok(" + value + ")" : "Fail(" + failure + ")";
    }
}
