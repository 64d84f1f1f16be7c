package com.flagship.payout_engine.payout;

import com.flagship.payout_engine.observability.CorrelationContext;
import com.flagship.payout_engine.payout.CancellationResult.ErrorCode;
import com.flagship.payout_engine.processor.PayoutGateway;
import com.flagship.payout_engine.processor.PayoutGatewayException;
import com.flagship.payout_engine.processor.ProcessorPayout;
import com.flagship.payout_engine.processor.ProcessorStatusMapper;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.StateTransition;
import com.flagship.payout_engine.transaction.StoreResult;
import com.flagship.payout_engine.transaction.TransactionFieldUpdates;
import com.flagship.payout_engine.transaction.TransactionState;
import com.flagship.payout_engine.transaction.TransactionStore;
import com.flagship.payout_engine.transaction.TransitionSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Cancels queued payouts on behalf of their owner.
 *
 * Only QUEUED payouts can be cancelled. When the processor already knows the
 * payout it is asked to cancel first, and the local transition only happens
 * once it answers "cancelled".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutCancellationService {

    private final TransactionStore transactionStore;
    private final PayoutGateway payoutGateway;
    private final Clock clock;

    public CancellationResult cancel(String transactionId, String userId) {
        Optional<PayoutTransaction> found = transactionStore.getByTransactionId(transactionId)
                .filter(tx -> tx.getUserId().equals(userId));
        if (found.isEmpty()) {
            return CancellationResult.refused(transactionId, null, ErrorCode.NOT_FOUND,
                    "Transaction not found: " + transactionId);
        }

        PayoutTransaction tx = found.get();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId);
        try {
            if (!tx.isCancellable()) {
                log.info("Cancellation refused: state={}", tx.getState());
                return CancellationResult.refused(transactionId, tx.getState(), ErrorCode.NOT_CANCELLABLE,
                        "Only queued payouts can be cancelled, payout is " + tx.getState().getValue());
            }

            TransactionFieldUpdates updates = TransactionFieldUpdates.none();
            String reason = "Cancelled by user";
            if (tx.hasExternalPayoutId()) {
                ProcessorPayout payout;
                try {
                    payout = payoutGateway.cancelPayout(tx.getExternalPayoutId());
                } catch (PayoutGatewayException e) {
                    log.warn("Processor cancel failed: externalPayoutId={}, error={}",
                            tx.getExternalPayoutId(), e.getMessage());
                    return CancellationResult.refused(transactionId, tx.getState(),
                            e.isTransient() ? ErrorCode.PROCESSOR_UNAVAILABLE : ErrorCode.PROCESSOR_REFUSED,
                            e.getMessage());
                }
                if (ProcessorStatusMapper.toState(payout.getStatus()).orElse(null) != TransactionState.CANCELLED) {
                    log.warn("Processor did not cancel payout: externalPayoutId={}, status={}",
                            tx.getExternalPayoutId(), payout.getStatus());
                    return CancellationResult.refused(transactionId, tx.getState(), ErrorCode.PROCESSOR_REFUSED,
                            "Processor reports status " + payout.getStatus());
                }
                updates = payout.toFieldUpdates(TransactionState.CANCELLED).build();
                reason = "Cancelled by user, confirmed by processor";
            }

            StateTransition transition = StateTransition.of(TransactionState.QUEUED, TransactionState.CANCELLED,
                    clock.instant(), TransitionSource.USER, reason);
            StoreResult<PayoutTransaction> applied = transactionStore.applyTransition(
                    transactionId, TransactionState.QUEUED, transition, updates);
            if (!applied.isOk()) {
                PayoutTransaction current = transactionStore.getByTransactionId(transactionId).orElse(tx);
                if (current.getState() == TransactionState.CANCELLED) {
                    // A webhook for the same cancellation landed first.
                    return CancellationResult.cancelled(current);
                }
                log.warn("Cancellation not applied: result={}, state={}", applied, current.getState());
                return CancellationResult.refused(transactionId, current.getState(), ErrorCode.CONFLICT,
                        applied.toString());
            }

            log.info("Payout cancelled");
            return CancellationResult.cancelled(applied.orElseThrow());
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }
}
