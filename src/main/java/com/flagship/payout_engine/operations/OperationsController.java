package com.flagship.payout_engine.operations;

import com.flagship.payout_engine.outbox.OutboxEvent;
import com.flagship.payout_engine.outbox.OutboxService;
import com.flagship.payout_engine.payout.exception.TransactionNotFoundException;
import com.flagship.payout_engine.reconciliation.ReconciliationResult;
import com.flagship.payout_engine.reconciliation.ReconciliationSummary;
import com.flagship.payout_engine.reconciliation.Reconciler;
import com.flagship.payout_engine.retry.RetryRunSummary;
import com.flagship.payout_engine.retry.RetryScheduler;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.TransactionStore;
import com.flagship.payout_engine.transaction.event.PayoutStateChangedEvent;
import com.flagship.payout_engine.webhook.WebhookEventRecord;
import com.flagship.payout_engine.webhook.WebhookEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * On-demand triggers for the retry and reconciliation runs that otherwise
 * execute on a schedule, plus read-only audit views of a payout's
 * outbox events and received webhooks.
 */
@RestController
@RequestMapping("/api/operations")
@RequiredArgsConstructor
@Slf4j
public class OperationsController {

    private final RetryScheduler retryScheduler;
    private final Reconciler reconciler;
    private final TransactionStore transactionStore;
    private final OutboxService outboxService;
    private final WebhookEventStore webhookEventStore;

    @PostMapping("/retries")
    public ResponseEntity<RetryRunSummary> runRetries() {
        log.info("Retry run requested");
        return ResponseEntity.ok(retryScheduler.processRetries());
    }

    @PostMapping("/reconciliation")
    public ResponseEntity<ReconciliationSummary> runReconciliation() {
        log.info("Reconciliation run requested");
        return ResponseEntity.ok(reconciler.reconcileAllPending());
    }

    @PostMapping("/reconciliation/{transactionId}")
    public ResponseEntity<ReconciliationResult> reconcileOne(@PathVariable("transactionId") String transactionId) {
        ReconciliationResult result = reconciler.reconcileOne(transactionId);
        if (result.getOutcome() == ReconciliationResult.Outcome.NOT_FOUND) {
            throw new TransactionNotFoundException(transactionId);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/payouts/{transactionId}/events")
    public ResponseEntity<List<OutboxEvent>> stateChangeEvents(@PathVariable("transactionId") String transactionId) {
        PayoutTransaction tx = requireTransaction(transactionId);
        return ResponseEntity.ok(outboxService.getEventsForAggregate(
                PayoutStateChangedEvent.AGGREGATE_TYPE, tx.getTransactionId()));
    }

    @GetMapping("/payouts/{transactionId}/webhooks")
    public ResponseEntity<List<WebhookEventRecord>> webhookEvents(@PathVariable("transactionId") String transactionId) {
        PayoutTransaction tx = requireTransaction(transactionId);
        if (!tx.hasExternalPayoutId()) {
            return ResponseEntity.ok(List.of());
        }
        return ResponseEntity.ok(webhookEventStore.findByExternalPayoutId(tx.getExternalPayoutId()));
    }

    private PayoutTransaction requireTransaction(String transactionId) {
        return transactionStore.getByTransactionId(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }
}
