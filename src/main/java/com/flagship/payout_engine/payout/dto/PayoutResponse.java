package com.flagship.payout_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_engine.transaction.FailureReason;
import com.flagship.payout_engine.transaction.PayoutMode;
import com.flagship.payout_engine.transaction.PayoutPurpose;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.StateTransition;
import com.flagship.payout_engine.transaction.TransactionState;
import com.flagship.payout_engine.transaction.TransactionType;
import com.flagship.payout_engine.transaction.TransitionSource;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a payout transaction.
 * The transition history is only included for single-payout lookups.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PayoutResponse {

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("external_payout_id")
    String externalPayoutId;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("fund_account_ref")
    String fundAccountRef;

    @JsonProperty("beneficiary_name")
    String beneficiaryName;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("mode")
    PayoutMode mode;

    @JsonProperty("purpose")
    PayoutPurpose purpose;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("fees")
    Long fees;

    @JsonProperty("tax")
    Long tax;

    @JsonProperty("utr")
    String utr;

    @JsonProperty("narration")
    String narration;

    @JsonProperty("state")
    TransactionState state;

    @JsonProperty("previous_state")
    TransactionState previousState;

    @JsonProperty("retry_count")
    int retryCount;

    @JsonProperty("next_retry_at")
    Instant nextRetryAt;

    @JsonProperty("failure_reason")
    FailureReason failureReason;

    @JsonProperty("failure_description")
    String failureDescription;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("failed_at")
    Instant failedAt;

    @JsonProperty("state_history")
    List<TransitionResponse> stateHistory;

    public static PayoutResponse from(PayoutTransaction tx) {
        return base(tx).build();
    }

    public static PayoutResponse withHistory(PayoutTransaction tx) {
        return base(tx)
                .stateHistory(tx.getStateHistory().stream().map(TransitionResponse::from).toList())
                .build();
    }

    private static PayoutResponseBuilder base(PayoutTransaction tx) {
        return PayoutResponse.builder()
                .transactionId(tx.getTransactionId())
                .externalPayoutId(tx.getExternalPayoutId())
                .userId(tx.getUserId())
                .fundAccountRef(tx.getFundAccountRef())
                .beneficiaryName(tx.getBeneficiaryName())
                .type(tx.getType())
                .mode(tx.getMode())
                .purpose(tx.getPurpose())
                .amount(tx.getAmount())
                .currency(tx.getCurrency())
                .fees(tx.getFees())
                .tax(tx.getTax())
                .utr(tx.getUtr())
                .narration(tx.getNarration())
                .state(tx.getState())
                .previousState(tx.getPreviousState())
                .retryCount(tx.getRetryCount())
                .nextRetryAt(tx.getNextRetryAt())
                .failureReason(tx.getFailureReason())
                .failureDescription(tx.getFailureDescription())
                .metadata(tx.getMetadata())
                .createdAt(tx.getCreatedAt())
                .updatedAt(tx.getUpdatedAt())
                .submittedAt(tx.getSubmittedAt())
                .completedAt(tx.getCompletedAt())
                .failedAt(tx.getFailedAt());
    }

    public record TransitionResponse(
            @JsonProperty("from") TransactionState from,
            @JsonProperty("to") TransactionState to,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("reason") String reason,
            @JsonProperty("source") TransitionSource source,
            @JsonProperty("metadata") Map<String, String> metadata) {

        static TransitionResponse from(StateTransition transition) {
            return new TransitionResponse(transition.getFrom(), transition.getTo(), transition.getTimestamp(),
                    transition.getReason(), transition.getSource(), transition.getMetadata());
        }
    }
}
