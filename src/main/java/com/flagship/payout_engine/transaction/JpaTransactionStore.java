package com.flagship.payout_engine.transaction;

import com.flagship.payout_engine.observability.PayoutMetrics;
import com.flagship.payout_engine.outbox.OutboxService;
import com.flagship.payout_engine.transaction.event.PayoutStateChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of {@link TransactionStore}.
 *
 * Writes run in a {@link TransactionTemplate} so that unique-key and
 * optimistic-lock failures, which surface at flush or commit, can be turned
 * into ALREADY_EXISTS and CONFLICT results after the rollback.
 *
 * Every applied transition writes a {@link PayoutStateChangedEvent} to the
 * outbox in the same database transaction.
 */
@Service
@Slf4j
public class JpaTransactionStore implements TransactionStore {

    private final TransactionRepository repository;
    private final TransactionJsonCodec codec;
    private final OutboxService outboxService;
    private final PayoutMetrics payoutMetrics;
    private final TransactionTemplate transactionTemplate;

    public JpaTransactionStore(TransactionRepository repository,
                               TransactionJsonCodec codec,
                               OutboxService outboxService,
                               PayoutMetrics payoutMetrics,
                               PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.codec = codec;
        this.outboxService = outboxService;
        this.payoutMetrics = payoutMetrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public StoreResult<PayoutTransaction> create(PayoutTransaction transaction) {
        try {
            return transactionTemplate.execute(status -> {
                TransactionEntity saved = repository.saveAndFlush(codec.toEntity(transaction));
                PayoutTransaction created = codec.toDomain(saved);
                StateTransition initial = created.getStateHistory().get(0);
                outboxService.saveEvent(PayoutStateChangedEvent.AGGREGATE_TYPE, created.getTransactionId(),
                        PayoutStateChangedEvent.EVENT_TYPE, PayoutStateChangedEvent.of(created, initial));
                return StoreResult.ok(created);
            });
        } catch (DataIntegrityViolationException e) {
            // Only a committed row holding our key makes this a duplicate.
            if (repository.findByIdempotencyKey(transaction.getIdempotencyKey()).isEmpty()) {
                log.error("Payout insert rejected by the database: transactionId={}",
                        transaction.getTransactionId(), e);
                throw e;
            }
            log.warn("Payout already exists: transactionId={}, idempotencyKey={}",
                    transaction.getTransactionId(), transaction.getIdempotencyKey());
            return StoreResult.alreadyExists(
                    "Transaction with idempotency key " + transaction.getIdempotencyKey() + " already exists");
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PayoutTransaction> getByTransactionId(String transactionId) {
        return repository.findById(transactionId).map(codec::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PayoutTransaction> getByExternalPayoutId(String externalPayoutId) {
        if (externalPayoutId == null || externalPayoutId.isBlank()) {
            return Optional.empty();
        }
        return repository.findByExternalPayoutId(externalPayoutId).map(codec::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PayoutTransaction> getByIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        return repository.findByIdempotencyKey(idempotencyKey).map(codec::toDomain);
    }

    @Override
    public StoreResult<PayoutTransaction> applyTransition(String transactionId,
                                                          TransactionState expectedState,
                                                          StateTransition transition,
                                                          TransactionFieldUpdates updates) {
        StoreResult<PayoutTransaction> result;
        try {
            result = transactionTemplate.execute(status -> doApplyTransition(
                    transactionId, expectedState, transition, updates));
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent update lost: transactionId={}, {} -> {}",
                    transactionId, transition.getFrom(), transition.getTo());
            return StoreResult.conflict("Transaction " + transactionId + " was modified concurrently");
        }

        if (result != null && result.isOk()) {
            payoutMetrics.recordTransition(transition.getSource().getValue(), transition.getTo().getValue());
            log.info("Payout transition applied: transactionId={}, from={}, to={}, source={}",
                    transactionId, transition.getFrom(), transition.getTo(), transition.getSource());
        }
        return result;
    }

    private StoreResult<PayoutTransaction> doApplyTransition(String transactionId,
                                                             TransactionState expectedState,
                                                             StateTransition transition,
                                                             TransactionFieldUpdates updates) {
        Optional<TransactionEntity> found = repository.findById(transactionId);
        if (found.isEmpty()) {
            return StoreResult.notFound("Transaction not found: " + transactionId);
        }
        TransactionEntity entity = found.get();

        if (entity.getState() != expectedState) {
            return StoreResult.conflict("Expected state " + expectedState + " but found " + entity.getState());
        }
        if (transition.getFrom() != expectedState
                || !TransactionStateMachine.isRecordable(expectedState, transition.getTo())) {
            return StoreResult.invalidTransition(
                    "Invalid transition " + expectedState + " -> " + transition.getTo());
        }

        PayoutTransaction updated = codec.toDomain(entity).withTransition(transition, updates);
        entity.updateFromDomain(updated, codec.writeHistory(updated.getStateHistory()));

        PayoutTransaction saved = codec.toDomain(repository.saveAndFlush(entity));
        outboxService.saveEvent(PayoutStateChangedEvent.AGGREGATE_TYPE, transactionId,
                PayoutStateChangedEvent.EVENT_TYPE, PayoutStateChangedEvent.of(saved, transition));
        return StoreResult.ok(saved);
    }

    @Override
    public StoreResult<PayoutTransaction> claimForRetry(String transactionId, int expectedRetryCount,
                                                        Instant now, Instant leaseUntil) {
        Integer claimed = transactionTemplate.execute(status ->
                repository.claimForRetry(transactionId, expectedRetryCount, now, leaseUntil));
        if (claimed == null || claimed == 0) {
            return StoreResult.conflict("Retry for " + transactionId + " was claimed or moved by another worker");
        }
        return getByTransactionId(transactionId)
                .map(StoreResult::ok)
                .orElseGet(() -> StoreResult.notFound("Transaction not found: " + transactionId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PayoutTransaction> findDueForRetry(Instant now, int limit) {
        return repository.findDueForRetry(now, PageRequest.of(0, limit))
                .stream()
                .map(codec::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<PayoutTransaction> findNonTerminalWithExternalId(Collection<TransactionState> states, int limit) {
        return repository.findByStateInWithExternalId(states, PageRequest.of(0, limit))
                .stream()
                .map(codec::toDomain)
                .toList();
    }
}
