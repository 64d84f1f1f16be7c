package com.flagship.payout_engine.retry;

import com.flagship.payout_engine.config.PayoutProperties;
import com.flagship.payout_engine.observability.CorrelationContext;
import com.flagship.payout_engine.observability.PayoutMetrics;
import com.flagship.payout_engine.processor.CreatePayoutCommand;
import com.flagship.payout_engine.processor.PayoutGateway;
import com.flagship.payout_engine.processor.PayoutGatewayException;
import com.flagship.payout_engine.processor.ProcessorPayout;
import com.flagship.payout_engine.processor.ProcessorStatusMapper;
import com.flagship.payout_engine.transaction.FailureReason;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.StateTransition;
import com.flagship.payout_engine.transaction.StoreResult;
import com.flagship.payout_engine.transaction.TransactionFieldUpdates;
import com.flagship.payout_engine.transaction.TransactionState;
import com.flagship.payout_engine.transaction.TransactionStateMachine;
import com.flagship.payout_engine.transaction.TransactionStore;
import com.flagship.payout_engine.transaction.TransitionSource;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Resubmits payouts whose creation call failed transiently.
 *
 * Only SUBMITTED payouts with a due nextRetryAt are picked up. A payout the
 * processor already accepted (queued, pending, processing) is never
 * resubmitted; the reconciler polls those instead.
 *
 * Each candidate is claimed before the processor call, so two workers never
 * resubmit the same payout in the same window. Resubmission always reuses the
 * original idempotency key as reference id.
 */
@Service
@Slf4j
public class RetryScheduler {

    private final TransactionStore transactionStore;
    private final PayoutGateway payoutGateway;
    private final PayoutProperties.Retry config;
    private final BackoffPolicy backoffPolicy;
    private final PayoutMetrics payoutMetrics;
    private final Clock clock;

    public RetryScheduler(TransactionStore transactionStore,
                          PayoutGateway payoutGateway,
                          PayoutProperties properties,
                          PayoutMetrics payoutMetrics,
                          Clock clock) {
        this.transactionStore = transactionStore;
        this.payoutGateway = payoutGateway;
        this.config = properties.getRetry();
        this.backoffPolicy = BackoffPolicy.from(config);
        this.payoutMetrics = payoutMetrics;
        this.clock = clock;
    }

    public RetryRunSummary processRetries() {
        Instant now = clock.instant();
        var due = transactionStore.findDueForRetry(now, config.getBatchSize());
        RetryRunSummary.RetryRunSummaryBuilder summary = RetryRunSummary.builder();
        int succeeded = 0;
        int failed = 0;
        int rescheduled = 0;
        int skipped = 0;

        for (PayoutTransaction tx : due) {
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, tx.getTransactionId());
            try {
                RetryOutcome outcome = retryOne(tx, now);
                payoutMetrics.recordRetry(outcome.name().toLowerCase());
                switch (outcome) {
                    case SUCCEEDED -> succeeded++;
                    case FAILED -> failed++;
                    case RESCHEDULED -> rescheduled++;
                    case SKIPPED -> skipped++;
                }
            } catch (RuntimeException e) {
                log.error("Retry failed unexpectedly: transactionId={}", tx.getTransactionId(), e);
                payoutMetrics.recordRetry("error");
                summary.error(tx.getTransactionId() + ": " + e.getMessage());
            } finally {
                MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
            }
        }

        RetryRunSummary result = summary
                .processed(due.size())
                .succeeded(succeeded)
                .failed(failed)
                .rescheduled(rescheduled)
                .skipped(skipped)
                .build();
        if (!due.isEmpty()) {
            log.info("Retry run finished: processed={}, succeeded={}, failed={}, rescheduled={}, skipped={}, errors={}",
                    result.getProcessed(), result.getSucceeded(), result.getFailed(),
                    result.getRescheduled(), result.getSkipped(), result.getErrors().size());
        }
        return result;
    }

    private RetryOutcome retryOne(PayoutTransaction candidate, Instant now) {
        StoreResult<PayoutTransaction> claim = transactionStore.claimForRetry(
                candidate.getTransactionId(), candidate.getRetryCount(), now, now.plus(config.getClaimLease()));
        if (!claim.isOk()) {
            log.info("Retry skipped, claimed elsewhere: result={}", claim);
            return RetryOutcome.SKIPPED;
        }
        PayoutTransaction tx = claim.orElseThrow();
        int attempt = tx.getRetryCount() + 1;
        log.info("Resubmitting payout: attempt={}, maxRetries={}", attempt, tx.getMaxRetries());

        ProcessorPayout payout;
        try {
            payout = payoutGateway.createPayout(CreatePayoutCommand.forTransaction(tx));
        } catch (PayoutGatewayException e) {
            return e.isTransient() ? recordTransientFailure(tx, attempt, e) : recordRejection(tx, attempt, e);
        }
        return recordAcceptance(tx, attempt, payout);
    }

    private RetryOutcome recordAcceptance(PayoutTransaction tx, int attempt, ProcessorPayout payout) {
        Instant now = clock.instant();
        Optional<TransactionState> mapped = ProcessorStatusMapper.toState(payout.getStatus());
        boolean reachable = mapped.isPresent()
                && TransactionStateMachine.isValidTransition(TransactionState.SUBMITTED, mapped.get());
        TransactionState target = reachable ? mapped.get() : TransactionState.SUBMITTED;

        StateTransition transition = StateTransition.builder()
                .from(TransactionState.SUBMITTED)
                .to(target)
                .timestamp(now)
                .source(TransitionSource.SYSTEM)
                .reason(reachable
                        ? "Resubmission accepted with status " + payout.getStatus()
                        : "Resubmission returned status " + payout.getStatus() + "; awaiting reconciliation")
                .metadata(Map.of(
                        "attempt", String.valueOf(attempt),
                        "external_payout_id", payout.getId(),
                        "processor_status", String.valueOf(payout.getStatus())))
                .build();
        TransactionFieldUpdates updates = payout.toFieldUpdates(target)
                .submittedAt(now)
                .clearNextRetryAt(true)
                .build();

        StoreResult<PayoutTransaction> applied = transactionStore.applyTransition(
                tx.getTransactionId(), TransactionState.SUBMITTED, transition, updates);
        if (!applied.isOk()) {
            log.warn("Retry result not applied: result={}", applied);
            return RetryOutcome.SKIPPED;
        }
        return target.isFailedTerminal() ? RetryOutcome.FAILED : RetryOutcome.SUCCEEDED;
    }

    private RetryOutcome recordTransientFailure(PayoutTransaction tx, int attempt, PayoutGatewayException e) {
        Instant now = clock.instant();
        boolean exhausted = attempt >= tx.getMaxRetries();

        StateTransition.StateTransitionBuilder transition = StateTransition.builder()
                .from(TransactionState.SUBMITTED)
                .timestamp(now)
                .source(TransitionSource.SYSTEM)
                .metadata(Map.of("attempt", String.valueOf(attempt)));
        TransactionFieldUpdates.TransactionFieldUpdatesBuilder updates = TransactionFieldUpdates.builder()
                .retryCount(attempt)
                .failureDescription(e.getMessage());

        if (exhausted) {
            transition.to(TransactionState.FAILED)
                    .reason("Retries exhausted after " + attempt + " attempts: " + e.getMessage());
            updates.failureReason(e.isTimeout() ? FailureReason.TIMEOUT : FailureReason.NETWORK_ERROR);
        } else {
            Instant nextRetryAt = now.plus(backoffPolicy.delayFor(attempt));
            transition.to(TransactionState.SUBMITTED)
                    .reason("Resubmission attempt " + attempt + " failed: " + e.getMessage());
            updates.nextRetryAt(nextRetryAt);
        }

        StoreResult<PayoutTransaction> applied = transactionStore.applyTransition(
                tx.getTransactionId(), TransactionState.SUBMITTED, transition.build(), updates.build());
        if (!applied.isOk()) {
            log.warn("Retry failure not recorded: result={}", applied);
            return RetryOutcome.SKIPPED;
        }
        if (exhausted) {
            log.warn("Payout failed after exhausting retries: attempts={}, error={}", attempt, e.getMessage());
            return RetryOutcome.FAILED;
        }
        log.warn("Resubmission failed, rescheduled: attempt={}, nextRetryAt={}, error={}",
                attempt, applied.orElseThrow().getNextRetryAt(), e.getMessage());
        return RetryOutcome.RESCHEDULED;
    }

    private RetryOutcome recordRejection(PayoutTransaction tx, int attempt, PayoutGatewayException e) {
        StateTransition transition = StateTransition.builder()
                .from(TransactionState.SUBMITTED)
                .to(TransactionState.FAILED)
                .timestamp(clock.instant())
                .source(TransitionSource.SYSTEM)
                .reason("Processor rejected resubmission")
                .metadata(Map.of("attempt", String.valueOf(attempt)))
                .build();
        TransactionFieldUpdates updates = TransactionFieldUpdates.builder()
                .retryCount(attempt)
                .failureReason(FailureReason.PAYOUT_REJECTED)
                .failureDescription(e.getMessage())
                .build();

        StoreResult<PayoutTransaction> applied = transactionStore.applyTransition(
                tx.getTransactionId(), TransactionState.SUBMITTED, transition, updates);
        if (!applied.isOk()) {
            log.warn("Retry rejection not recorded: result={}", applied);
            return RetryOutcome.SKIPPED;
        }
        log.warn("Resubmission rejected by processor: httpStatus={}, error={}", e.getHttpStatus(), e.getMessage());
        return RetryOutcome.FAILED;
    }

    private enum RetryOutcome {
        SUCCEEDED,
        FAILED,
        RESCHEDULED,
        SKIPPED
    }
}
