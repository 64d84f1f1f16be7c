package com.flagship.payout_engine.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of failure codes stored on a transaction.
 * Processor reason strings that are not listed here become UNKNOWN.
 */
public enum FailureReason {
    INSUFFICIENT_BALANCE("insufficient_balance"),
    INVALID_BENEFICIARY("invalid_beneficiary"),
    BENEFICIARY_BANK_DOWN("beneficiary_bank_down"),
    BENEFICIARY_ACCOUNT_CLOSED("beneficiary_account_closed"),
    BENEFICIARY_NAME_MISMATCH("beneficiary_name_mismatch"),
    LIMIT_EXCEEDED("limit_exceeded"),
    PAYOUT_REJECTED("payout_rejected"),
    COMPLIANCE_REJECTION("compliance_rejection"),
    NETWORK_ERROR("network_error"),
    TIMEOUT("timeout"),
    UNKNOWN("unknown");

    private final String value;

    FailureReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static FailureReason fromProcessorReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(r -> r.value.equalsIgnoreCase(reason.trim()))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
