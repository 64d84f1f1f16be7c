package com.flagship.payout_engine.transaction;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Fields written together with a state transition.
 *
 * A null field means "leave unchanged". nextRetryAt can only be cleared
 * through {@code clearNextRetryAt}, because null already means unchanged.
 */
@Value
@Builder
public class TransactionFieldUpdates {
    String externalPayoutId;
    String utr;
    Long fees;
    Long tax;
    FailureReason failureReason;
    String failureDescription;
    Integer retryCount;
    Instant nextRetryAt;
    boolean clearNextRetryAt;
    Instant submittedAt;

    private static final TransactionFieldUpdates NONE = TransactionFieldUpdates.builder().build();

    public static TransactionFieldUpdates none() {
        return NONE;
    }
}
