package com.flagship.payout_engine.transaction;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Per-user totals. completed counts completed and refund_completed; failed
 * counts failed, reversed and cancelled; everything else is pending.
 * Amounts are in paise.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TransactionStats {
    long total;
    long completed;
    long failed;
    long pending;
    long totalAmount;
    long completedAmount;
}
