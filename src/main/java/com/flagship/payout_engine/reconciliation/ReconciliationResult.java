package com.flagship.payout_engine.reconciliation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.payout_engine.transaction.TransactionState;
import lombok.Builder;
import lombok.Value;

/**
 * Result of reconciling one transaction against the processor.
 *
 * reconciled is true when local state agrees with the processor after the
 * call, either because it already did or because a transition was applied.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReconciliationResult {

    public enum Outcome {
        UPDATED,
        IN_SYNC,
        DISCREPANCY,
        CONFLICT,
        NOT_FOUND,
        SKIPPED,
        ERROR
    }

    String transactionId;
    Outcome outcome;
    boolean reconciled;
    boolean changed;
    TransactionState previousState;
    TransactionState currentState;
    String processorStatus;
    String message;

    static ReconciliationResult of(String transactionId, Outcome outcome, TransactionState state, String message) {
        return ReconciliationResult.builder()
                .transactionId(transactionId)
                .outcome(outcome)
                .reconciled(outcome == Outcome.IN_SYNC)
                .previousState(state)
                .currentState(state)
                .message(message)
                .build();
    }
}
