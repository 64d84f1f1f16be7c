package com.flagship.payout_engine.transaction;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, String>,
        JpaSpecificationExecutor<TransactionEntity> {

    Optional<TransactionEntity> findByIdempotencyKey(String idempotencyKey);

    Optional<TransactionEntity> findByExternalPayoutId(String externalPayoutId);

    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.state = com.flagship.payout_engine.transaction.TransactionState.SUBMITTED
        AND t.nextRetryAt IS NOT NULL
        AND t.nextRetryAt <= :now
        AND t.retryCount < t.maxRetries
        ORDER BY t.nextRetryAt ASC
        """)
    List<TransactionEntity> findDueForRetry(@Param("now") Instant now, Pageable pageable);

    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.state IN :states
        AND t.externalPayoutId IS NOT NULL
        ORDER BY t.updatedAt ASC
        """)
    List<TransactionEntity> findByStateInWithExternalId(@Param("states") Collection<TransactionState> states,
                                                        Pageable pageable);

    /**
     * Compare-and-swap on (state, retryCount, due time). Bumps the version so
     * that a writer holding the row from before the claim loses.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE TransactionEntity t
        SET t.nextRetryAt = :leaseUntil, t.version = t.version + 1
        WHERE t.transactionId = :transactionId
        AND t.state = com.flagship.payout_engine.transaction.TransactionState.SUBMITTED
        AND t.retryCount = :expectedRetryCount
        AND t.nextRetryAt IS NOT NULL
        AND t.nextRetryAt <= :now
        """)
    int claimForRetry(@Param("transactionId") String transactionId,
                      @Param("expectedRetryCount") int expectedRetryCount,
                      @Param("now") Instant now,
                      @Param("leaseUntil") Instant leaseUntil);

    @Query("""
        SELECT COUNT(t) FROM TransactionEntity t
        WHERE t.state = com.flagship.payout_engine.transaction.TransactionState.SUBMITTED
        AND t.nextRetryAt IS NOT NULL
        AND t.nextRetryAt <= :now
        """)
    long countDueForRetry(@Param("now") Instant now);

    @Query("""
        SELECT t.state AS state, COUNT(t) AS count, COALESCE(SUM(t.amount), 0) AS amount
        FROM TransactionEntity t
        WHERE t.userId = :userId
        GROUP BY t.state
        """)
    List<StateTotals> summarizeByState(@Param("userId") String userId);

    interface StateTotals {
        TransactionState getState();

        Number getCount();

        Number getAmount();
    }
}
