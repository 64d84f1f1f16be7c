package com.flagship.payout_engine.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum TransactionType {
    TRANSFER("transfer"),
    PAYMENT("payment"),
    REFUND("refund"),
    CASHBACK("cashback"),
    SALARY("salary");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TransactionType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction type: " + value));
    }
}
