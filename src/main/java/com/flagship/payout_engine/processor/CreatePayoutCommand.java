package com.flagship.payout_engine.processor;

import com.flagship.payout_engine.transaction.PayoutTransaction;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Everything needed to create a payout at the processor.
 * referenceId carries the idempotency key and must be identical on every retry.
 */
@Value
@Builder
public class CreatePayoutCommand {
    String fundAccountId;
    long amount;
    String currency;
    String mode;
    String purpose;
    String referenceId;
    String narration;
    Map<String, String> notes;

    /**
     * Builds the create request for a stored transaction. Submission and
     * every retry go through here, so the reference id never changes.
     */
    public static CreatePayoutCommand forTransaction(PayoutTransaction tx) {
        return CreatePayoutCommand.builder()
                .fundAccountId(tx.getProcessorFundAccountId())
                .amount(tx.getAmount())
                .currency(tx.getCurrency())
                .mode(tx.getMode().getValue())
                .purpose(tx.getPurpose().getValue())
                .referenceId(tx.getIdempotencyKey())
                .narration(tx.getNarration())
                .notes(Map.of("transaction_id", tx.getTransactionId(), "user_id", tx.getUserId()))
                .build();
    }
}
