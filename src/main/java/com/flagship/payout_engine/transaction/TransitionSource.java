package com.flagship.payout_engine.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who caused a state transition.
 */
public enum TransitionSource {
    USER("user"),
    SYSTEM("system"),
    WEBHOOK("webhook"),
    RECONCILIATION("reconciliation");

    private final String value;

    TransitionSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
