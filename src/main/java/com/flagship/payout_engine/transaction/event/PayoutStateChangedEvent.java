package com.flagship.payout_engine.transaction.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.StateTransition;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Published through the outbox whenever a payout changes state or records
 * an audit entry. Downstream consumers (notifications, reporting) key on
 * transaction_id.
 */
@Value
@Builder
public class PayoutStateChangedEvent {
    public static final String EVENT_TYPE = "PayoutStateChanged";
    public static final String AGGREGATE_TYPE = "PayoutTransaction";

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("external_payout_id")
    String externalPayoutId;

    @JsonProperty("from_state")
    String fromState;

    @JsonProperty("to_state")
    String toState;

    @JsonProperty("source")
    String source;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("utr")
    String utr;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    public static PayoutStateChangedEvent of(PayoutTransaction tx, StateTransition transition) {
        return PayoutStateChangedEvent.builder()
                .transactionId(tx.getTransactionId())
                .userId(tx.getUserId())
                .externalPayoutId(tx.getExternalPayoutId())
                .fromState(transition.getFrom().getValue())
                .toState(transition.getTo().getValue())
                .source(transition.getSource() != null ? transition.getSource().getValue() : null)
                .reason(transition.getReason())
                .amount(tx.getAmount())
                .currency(tx.getCurrency())
                .utr(tx.getUtr())
                .failureReason(tx.getFailureReason() != null ? tx.getFailureReason().getValue() : null)
                .occurredAt(transition.getTimestamp())
                .build();
    }
}
