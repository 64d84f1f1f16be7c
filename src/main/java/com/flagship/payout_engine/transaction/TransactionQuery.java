package com.flagship.payout_engine.transaction;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Filters for listing transactions. Null fields do not filter.
 * Amounts are in paise; the created-at range is inclusive.
 */
@Value
@Builder
public class TransactionQuery {

    public static final int DEFAULT_LIMIT = 25;
    public static final int MAX_LIMIT = 100;

    public enum SortField {
        CREATED_AT("createdAt"),
        AMOUNT("amount"),
        STATE("state");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        public String getProperty() {
            return property;
        }
    }

    String userId;
    Set<TransactionState> states;
    TransactionType type;
    PayoutMode mode;
    Instant createdFrom;
    Instant createdTo;
    Long minAmount;
    Long maxAmount;
    Integer limit;
    Integer offset;
    @Builder.Default
    SortField sortBy = SortField.CREATED_AT;
    @Builder.Default
    boolean ascending = false;

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    public int effectiveOffset() {
        return offset == null || offset < 0 ? 0 : offset;
    }
}
