package com.flagship.payout_engine.processor;

import com.flagship.payout_engine.transaction.FailureReason;
import com.flagship.payout_engine.transaction.TransactionFieldUpdates;
import com.flagship.payout_engine.transaction.TransactionState;
import lombok.Builder;
import lombok.Value;

/**
 * A payout as reported by the processor.
 * Amounts are in paise; status is the processor's raw vocabulary.
 */
@Value
@Builder
public class ProcessorPayout {
    String id;
    String status;
    String utr;
    Long amount;
    Long fees;
    Long tax;
    String mode;
    String referenceId;
    String failureReason;
    String failureDescription;
    Long createdAt;

    /**
     * Field updates carried by this payout when the transaction moves to
     * {@code target}. Failure details are only copied for FAILED and REVERSED.
     */
    public TransactionFieldUpdates.TransactionFieldUpdatesBuilder toFieldUpdates(TransactionState target) {
        TransactionFieldUpdates.TransactionFieldUpdatesBuilder updates = TransactionFieldUpdates.builder()
                .externalPayoutId(id)
                .utr(blankToNull(utr))
                .fees(fees)
                .tax(tax);
        if (target == TransactionState.FAILED || target == TransactionState.REVERSED) {
            updates.failureReason(FailureReason.fromProcessorReason(failureReason))
                    .failureDescription(failureDescription != null ? failureDescription : "Processor reported " + status);
        }
        return updates;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
