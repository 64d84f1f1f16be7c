package com.flagship.payout_engine.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle states of a payout transaction.
 *
 * Allowed moves between states live in {@link TransactionStateMachine};
 * this enum only knows how each state is classified and spelled on the wire.
 */
public enum TransactionState {
    INITIATED("initiated"),
    SUBMITTED("submitted"),
    QUEUED("queued"),
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    REVERSED("reversed"),
    CANCELLED("cancelled"),
    REFUND_PENDING("refund_pending"),
    REFUND_COMPLETED("refund_completed");

    private final String value;

    TransactionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * States that end with money delivered. completedAt is stamped on entry.
     */
    public boolean isSuccessfulTerminal() {
        return this == COMPLETED || this == REFUND_COMPLETED;
    }

    /**
     * States that end without delivery. failedAt is stamped on entry.
     */
    public boolean isFailedTerminal() {
        return this == FAILED || this == REVERSED || this == CANCELLED;
    }

    public static TransactionState fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction state: " + value));
    }
}
