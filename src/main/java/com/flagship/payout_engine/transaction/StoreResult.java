package com.flagship.payout_engine.transaction;

import java.util.Optional;

/**
 * Outcome of a store operation.
 *
 * Not-found, conflict and invalid transitions are ordinary outcomes that
 * batch callers skip over, so they are returned rather than thrown.
 */
public final class StoreResult<T> {

    public enum Kind {
        OK,
        NOT_FOUND,
        ALREADY_EXISTS,
        CONFLICT,
        INVALID_TRANSITION
    }

    private final Kind kind;
    private final T value;
    private final String message;

    private StoreResult(Kind kind, T value, String message) {
        this.kind = kind;
        this.value = value;
        this.message = message;
    }

    public static <T> StoreResult<T> ok(T value) {
        return new StoreResult<>(Kind.OK, value, null);
    }

    public static <T> StoreResult<T> notFound(String message) {
        return new StoreResult<>(Kind.NOT_FOUND, null, message);
    }

    public static <T> StoreResult<T> alreadyExists(String message) {
        return new StoreResult<>(Kind.ALREADY_EXISTS, null, message);
    }

    public static <T> StoreResult<T> conflict(String message) {
        return new StoreResult<>(Kind.CONFLICT, null, message);
    }

    public static <T> StoreResult<T> invalidTransition(String message) {
        return new StoreResult<>(Kind.INVALID_TRANSITION, null, message);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    public String getMessage() {
        return message;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * Returns the value of an OK result.
     *
     * @throws IllegalStateException if the result is not OK
     */
    public T orElseThrow() {
        if (kind != Kind.OK) {
            throw new IllegalStateException("Store operation returned " + kind + ": " + message);
        }
        return value;
    }

    @Override
    public String toString() {
        return kind + (message != null ? "(" + message + ")" : "");
    }
}
