package com.flagship.budget_ledger.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a mutating ledger operation: either a value or a classified failure.
 *
 * @param <T> type of the value carried on success
 */
public final class OperationResult<T> {

    private final T value;
    private final LedgerErrorKind errorKind;
    private final String message;

    private OperationResult(T value, LedgerErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null, null);
    }

    public static <T> OperationResult<T> failure(LedgerErrorKind kind, String message) {
        return new OperationResult<>(null, Objects.requireNonNull(kind), message);
    }

    public static <T> OperationResult<T> failure(LedgerException e) {
        return failure(e.getKind(), e.getMessage());
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (isFailure()) {
            throw new IllegalStateException("No value on failed result: " + errorKind + " - " + message);
        }
        return value;
    }

    /**
     * Returns the value, or rethrows the classified failure as a {@link LedgerException}.
     */
    public T getOrThrow() {
        if (isFailure()) {
            throw new LedgerException(errorKind, message);
        }
        return value;
    }

    public LedgerErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return failure(errorKind, message);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "OperationResult[success, value=" + value + "]"
            : "OperationResult[" + errorKind + ", message=" + message + "]";
    }
}
