package com.flagship.payout_engine.reconciliation;

import com.flagship.payout_engine.config.PayoutProperties;
import com.flagship.payout_engine.observability.CorrelationContext;
import com.flagship.payout_engine.observability.PayoutMetrics;
import com.flagship.payout_engine.processor.PayoutGateway;
import com.flagship.payout_engine.processor.PayoutGatewayException;
import com.flagship.payout_engine.processor.ProcessorPayout;
import com.flagship.payout_engine.processor.ProcessorStatusMapper;
import com.flagship.payout_engine.reconciliation.ReconciliationResult.Outcome;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.StateTransition;
import com.flagship.payout_engine.transaction.StoreResult;
import com.flagship.payout_engine.transaction.TransactionFieldUpdates;
import com.flagship.payout_engine.transaction.TransactionState;
import com.flagship.payout_engine.transaction.TransactionStateMachine;
import com.flagship.payout_engine.transaction.TransactionStore;
import com.flagship.payout_engine.transaction.TransitionSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Polls the processor for the authoritative status of payouts and corrects
 * local drift left by missed or malformed webhooks.
 *
 * A status that maps to the current state is a no-op, so runs are safe to
 * repeat. A status that is not reachable from the current state is reported
 * as a discrepancy and never applied. Concurrent webhooks are handled by the
 * conditional write in {@link TransactionStore#applyTransition}: the loser
 * gets CONFLICT and the next run re-reads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Reconciler {

    static final Set<TransactionState> PENDING_STATES = EnumSet.of(
            TransactionState.SUBMITTED,
            TransactionState.QUEUED,
            TransactionState.PENDING,
            TransactionState.PROCESSING);

    private final TransactionStore transactionStore;
    private final PayoutGateway payoutGateway;
    private final PayoutProperties properties;
    private final PayoutMetrics payoutMetrics;
    private final Clock clock;

    public ReconciliationResult reconcileOne(String transactionId) {
        Optional<PayoutTransaction> found = transactionStore.getByTransactionId(transactionId);
        if (found.isEmpty()) {
            return record(ReconciliationResult.of(transactionId, Outcome.NOT_FOUND, null,
                    "Transaction not found: " + transactionId));
        }
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId);
        try {
            return record(reconcile(found.get()));
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    public ReconciliationSummary reconcileAllPending() {
        List<PayoutTransaction> pending = transactionStore.findNonTerminalWithExternalId(
                PENDING_STATES, properties.getReconciliation().getBatchSize());

        ReconciliationSummary.ReconciliationSummaryBuilder summary = ReconciliationSummary.builder();
        int reconciled = 0;
        int updated = 0;
        int discrepancies = 0;
        int conflicts = 0;
        int failed = 0;

        for (PayoutTransaction tx : pending) {
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, tx.getTransactionId());
            try {
                ReconciliationResult result = record(reconcile(tx));
                if (result.isReconciled()) {
                    reconciled++;
                }
                switch (result.getOutcome()) {
                    case UPDATED -> updated++;
                    case DISCREPANCY -> discrepancies++;
                    case CONFLICT -> conflicts++;
                    case ERROR -> {
                        failed++;
                        summary.error(tx.getTransactionId() + ": " + result.getMessage());
                    }
                    default -> {
                        // IN_SYNC, SKIPPED and NOT_FOUND only count as checked
                    }
                }
            } catch (RuntimeException e) {
                log.error("Reconciliation failed unexpectedly: transactionId={}", tx.getTransactionId(), e);
                failed++;
                summary.error(tx.getTransactionId() + ": " + e.getMessage());
            } finally {
                MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
            }
        }

        ReconciliationSummary result = summary
                .checked(pending.size())
                .reconciled(reconciled)
                .updated(updated)
                .discrepancies(discrepancies)
                .conflicts(conflicts)
                .failed(failed)
                .build();
        if (!pending.isEmpty()) {
            log.info("Reconciliation run finished: checked={}, reconciled={}, updated={}, discrepancies={}, conflicts={}, failed={}",
                    result.getChecked(), result.getReconciled(), result.getUpdated(),
                    result.getDiscrepancies(), result.getConflicts(), result.getFailed());
        }
        return result;
    }

    private ReconciliationResult reconcile(PayoutTransaction tx) {
        if (!tx.hasExternalPayoutId()) {
            return ReconciliationResult.of(tx.getTransactionId(), Outcome.SKIPPED, tx.getState(),
                    "No external payout id to reconcile against");
        }

        ProcessorPayout payout;
        try {
            payout = payoutGateway.getPayout(tx.getExternalPayoutId());
        } catch (PayoutGatewayException e) {
            log.warn("Processor status fetch failed: externalPayoutId={}, error={}",
                    tx.getExternalPayoutId(), e.getMessage());
            return ReconciliationResult.of(tx.getTransactionId(), Outcome.ERROR, tx.getState(), e.getMessage());
        }

        Optional<TransactionState> mapped = ProcessorStatusMapper.toState(payout.getStatus());
        if (mapped.isEmpty()) {
            log.warn("Unrecognized processor status: status={}, state={}", payout.getStatus(), tx.getState());
            return withStatus(ReconciliationResult.of(tx.getTransactionId(), Outcome.DISCREPANCY, tx.getState(),
                    "Unrecognized processor status: " + payout.getStatus()), payout);
        }

        TransactionState target = mapped.get();
        if (target == tx.getState()) {
            return withStatus(ReconciliationResult.of(tx.getTransactionId(), Outcome.IN_SYNC, tx.getState(), null), payout);
        }
        if (!TransactionStateMachine.isValidTransition(tx.getState(), target)) {
            log.warn("Processor status not reachable: from={}, to={}, status={}",
                    tx.getState(), target, payout.getStatus());
            return withStatus(ReconciliationResult.of(tx.getTransactionId(), Outcome.DISCREPANCY, tx.getState(),
                    "Processor reports " + payout.getStatus() + ", not reachable from " + tx.getState().getValue()
                            + " (allowed: " + TransactionStateMachine.allowedTransitions(tx.getState()) + ")"),
                    payout);
        }

        StateTransition transition = StateTransition.builder()
                .from(tx.getState())
                .to(target)
                .timestamp(clock.instant())
                .source(TransitionSource.RECONCILIATION)
                .reason("Reconciled with processor status " + payout.getStatus())
                .metadata(Map.of("processor_status", payout.getStatus()))
                .build();
        TransactionFieldUpdates updates = payout.toFieldUpdates(target).clearNextRetryAt(true).build();

        StoreResult<PayoutTransaction> applied = transactionStore.applyTransition(
                tx.getTransactionId(), tx.getState(), transition, updates);
        if (!applied.isOk()) {
            log.warn("Reconciliation lost to a concurrent update: result={}", applied);
            return withStatus(ReconciliationResult.of(tx.getTransactionId(), Outcome.CONFLICT, tx.getState(),
                    applied.toString()), payout);
        }
        return ReconciliationResult.builder()
                .transactionId(tx.getTransactionId())
                .outcome(Outcome.UPDATED)
                .reconciled(true)
                .changed(true)
                .previousState(tx.getState())
                .currentState(target)
                .processorStatus(payout.getStatus())
                .build();
    }

    private ReconciliationResult withStatus(ReconciliationResult result, ProcessorPayout payout) {
        return result.toBuilder().processorStatus(payout.getStatus()).build();
    }

    private ReconciliationResult record(ReconciliationResult result) {
        payoutMetrics.recordReconciliation(result.getOutcome().name().toLowerCase());
        return result;
    }
}
