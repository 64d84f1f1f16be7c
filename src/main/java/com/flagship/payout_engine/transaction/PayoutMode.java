package com.flagship.payout_engine.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Settlement rails supported for payouts, with their amount limits.
 *
 * Limits are held in paise. A null maximum means the rail has no ceiling.
 */
public enum PayoutMode {
    UPI("UPI", 100L, 100_000_00L),
    IMPS("IMPS", 100L, 500_000_00L),
    NEFT("NEFT", 100L, null),
    RTGS("RTGS", 200_000_00L, null);

    private final String value;
    private final long minAmount;
    private final Long maxAmount;

    PayoutMode(String value, long minAmount, Long maxAmount) {
        this.value = value;
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public long getMinAmount() {
        return minAmount;
    }

    public Long getMaxAmount() {
        return maxAmount;
    }

    public boolean accepts(long amountInPaise) {
        return amountInPaise >= minAmount && (maxAmount == null || amountInPaise <= maxAmount);
    }

    /**
     * Human readable limit description used in validation errors.
     */
    public String describeLimits() {
        String min = "₹" + (minAmount / 100);
        return maxAmount == null
                ? value + " requires at least " + min
                : value + " accepts " + min + " to ₹" + (maxAmount / 100);
    }

    public static PayoutMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(m -> m.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported payout mode: " + value));
    }
}
