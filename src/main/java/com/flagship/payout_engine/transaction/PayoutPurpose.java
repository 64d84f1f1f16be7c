package com.flagship.payout_engine.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Regulatory purpose codes accepted by the processor.
 */
public enum PayoutPurpose {
    REFUND("refund"),
    CASHBACK("cashback"),
    PAYOUT("payout"),
    SALARY("salary"),
    UTILITY_BILL("utility bill"),
    VENDOR_BILL("vendor bill");

    private final String value;

    PayoutPurpose(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PayoutPurpose fromValue(String value) {
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported payout purpose: " + value));
    }
}
