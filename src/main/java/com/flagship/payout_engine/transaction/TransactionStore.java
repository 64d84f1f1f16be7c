package com.flagship.payout_engine.transaction;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The only gateway to persisted payout transactions.
 *
 * Every state change goes through {@link #applyTransition}, which is a
 * conditional write: it succeeds only if the stored state still equals the
 * expected state when the write happens. A losing writer gets CONFLICT and
 * is expected to drop its work; the next tick re-reads fresh state.
 */
public interface TransactionStore {

    /**
     * Persists a new transaction.
     * Returns ALREADY_EXISTS if the idempotency key is taken.
     */
    StoreResult<PayoutTransaction> create(PayoutTransaction transaction);

    Optional<PayoutTransaction> getByTransactionId(String transactionId);

    Optional<PayoutTransaction> getByExternalPayoutId(String externalPayoutId);

    Optional<PayoutTransaction> getByIdempotencyKey(String idempotencyKey);

    /**
     * Moves a transaction from {@code expectedState} along {@code transition}.
     *
     * @return OK with the updated transaction, NOT_FOUND, CONFLICT if the
     *         stored state moved on, or INVALID_TRANSITION if the move is
     *         not allowed from the expected state
     */
    StoreResult<PayoutTransaction> applyTransition(String transactionId,
                                                   TransactionState expectedState,
                                                   StateTransition transition,
                                                   TransactionFieldUpdates updates);

    /**
     * Claims a due retry for one worker by pushing nextRetryAt to
     * {@code leaseUntil}. Succeeds only if the transaction is still SUBMITTED,
     * still has {@code expectedRetryCount} and is still due at {@code now}.
     *
     * @return OK with the claimed transaction, or CONFLICT when another
     *         worker claimed or moved it first
     */
    StoreResult<PayoutTransaction> claimForRetry(String transactionId, int expectedRetryCount,
                                                 Instant now, Instant leaseUntil);

    /**
     * SUBMITTED transactions with nextRetryAt at or before {@code now} and
     * retryCount below their own maxRetries, oldest due first.
     */
    List<PayoutTransaction> findDueForRetry(Instant now, int limit);

    /**
     * Transactions in one of {@code states} that carry an external payout id,
     * least recently updated first.
     */
    List<PayoutTransaction> findNonTerminalWithExternalId(Collection<TransactionState> states, int limit);
}
