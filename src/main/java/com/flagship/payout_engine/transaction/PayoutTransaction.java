package com.flagship.payout_engine.transaction;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Domain model for a payout transaction.
 *
 * Immutable: every change produces a new instance through
 * {@link #withTransition(StateTransition, TransactionFieldUpdates)}, which is
 * the only way state, history and the fields tied to a transition move.
 *
 * Invariants held here:
 * - amount, currency, purpose and the idempotency key never change
 * - history is append-only
 * - each timestamp is set at most once
 * - retryCount never exceeds maxRetries
 */
@Value
@Builder(toBuilder = true)
public class PayoutTransaction {
    public static final String CURRENCY_INR = "INR";

    String transactionId;
    String idempotencyKey;
    String externalPayoutId;
    String userId;
    String fundAccountRef;
    String processorFundAccountId;
    String processorContactId;
    String beneficiaryName;
    TransactionType type;
    PayoutMode mode;
    PayoutPurpose purpose;
    long amount;
    String currency;
    Long fees;
    Long tax;
    String utr;
    String narration;
    TransactionState state;
    TransactionState previousState;
    List<StateTransition> stateHistory;
    int retryCount;
    int maxRetries;
    Instant nextRetryAt;
    FailureReason failureReason;
    String failureDescription;
    Map<String, String> metadata;
    Instant createdAt;
    Instant updatedAt;
    Instant submittedAt;
    Instant completedAt;
    Instant failedAt;
    Long version;

    public boolean isTerminal() {
        return TransactionStateMachine.isTerminal(state);
    }

    public boolean isCancellable() {
        return state == TransactionState.QUEUED;
    }

    public boolean hasExternalPayoutId() {
        return externalPayoutId != null && !externalPayoutId.isBlank();
    }

    public List<StateTransition> getStateHistory() {
        return stateHistory == null ? List.of() : Collections.unmodifiableList(stateHistory);
    }

    public Map<String, String> getMetadata() {
        return metadata == null ? Map.of() : Collections.unmodifiableMap(metadata);
    }

    /**
     * Creates a new transaction in INITIATED with its initial self-record.
     */
    public static PayoutTransaction initiate(PayoutTransaction draft, Instant now) {
        StateTransition initial = StateTransition.of(
                TransactionState.INITIATED, TransactionState.INITIATED, now,
                TransitionSource.USER, "Payout initiated");
        return draft.toBuilder()
                .state(TransactionState.INITIATED)
                .previousState(null)
                .stateHistory(List.of(initial))
                .currency(draft.getCurrency() == null ? CURRENCY_INR : draft.getCurrency())
                .retryCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Applies a transition and its field updates.
     *
     * @throws IllegalStateException if the transition does not start at the
     *         current state or may not be recorded
     * @throws IllegalArgumentException if the retry count would exceed maxRetries
     */
    public PayoutTransaction withTransition(StateTransition transition, TransactionFieldUpdates updates) {
        if (transition.getFrom() != state) {
            throw new IllegalStateException(
                    "Transition starts at " + transition.getFrom() + " but payout " + transactionId + " is " + state);
        }
        if (!TransactionStateMachine.isRecordable(state, transition.getTo())) {
            throw new IllegalStateException(
                    "Cannot record transition " + state + " -> " + transition.getTo() + " for payout " + transactionId);
        }
        TransactionFieldUpdates u = updates == null ? TransactionFieldUpdates.none() : updates;
        if (u.getRetryCount() != null && u.getRetryCount() > maxRetries) {
            throw new IllegalArgumentException(
                    "Retry count " + u.getRetryCount() + " exceeds max retries " + maxRetries);
        }

        TransactionState target = transition.getTo();
        Instant at = transition.getTimestamp();

        List<StateTransition> history = new ArrayList<>(getStateHistory());
        history.add(transition);

        PayoutTransactionBuilder next = toBuilder()
                .stateHistory(List.copyOf(history))
                .updatedAt(at);

        if (target != state) {
            next.previousState(state).state(target);
        }
        if (externalPayoutId == null && u.getExternalPayoutId() != null) {
            next.externalPayoutId(u.getExternalPayoutId());
        }
        if (u.getUtr() != null) {
            next.utr(u.getUtr());
        }
        if (u.getFees() != null) {
            next.fees(u.getFees());
        }
        if (u.getTax() != null) {
            next.tax(u.getTax());
        }
        if (u.getFailureReason() != null) {
            next.failureReason(u.getFailureReason());
        }
        if (u.getFailureDescription() != null) {
            next.failureDescription(u.getFailureDescription());
        }
        if (u.getRetryCount() != null) {
            next.retryCount(u.getRetryCount());
        }
        if (u.isClearNextRetryAt() || TransactionStateMachine.isTerminal(target)) {
            next.nextRetryAt(null);
        } else if (u.getNextRetryAt() != null) {
            next.nextRetryAt(u.getNextRetryAt());
        }
        if (submittedAt == null && u.getSubmittedAt() != null) {
            next.submittedAt(u.getSubmittedAt());
        }
        // completedAt survives a later reversal or refund: it marks when the payee was paid.
        if (completedAt == null && target.isSuccessfulTerminal()) {
            next.completedAt(at);
        }
        if (failedAt == null && target.isFailedTerminal()) {
            next.failedAt(at);
        }
        return next.build();
    }
}
