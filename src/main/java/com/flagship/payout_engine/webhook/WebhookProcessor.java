package com.flagship.payout_engine.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payout_engine.observability.CorrelationContext;
import com.flagship.payout_engine.observability.PayoutMetrics;
import com.flagship.payout_engine.processor.PayoutGateway;
import com.flagship.payout_engine.processor.ProcessorPayout;
import com.flagship.payout_engine.processor.ProcessorStatusMapper;
import com.flagship.payout_engine.processor.RazorpayPayoutGateway.PayoutEntity;
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

import java.io.IOException;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies processor webhooks to payout transactions.
 *
 * Order of work for one delivery:
 * 1. Verify the signature over the raw body (the only rejection the sender sees)
 * 2. Derive the event id; a known id is a duplicate and returns at once
 * 3. Insert the event record, unprocessed, before touching any transaction
 * 4. Find the transaction by external payout id, then by reference id
 * 5. Map the status and apply the transition with source=webhook
 * 6. Mark the event record processed with its outcome
 *
 * Not transactional on purpose: the event record insert commits on its own so
 * that it excludes a concurrent delivery of the same event, and the
 * transaction update is a separate conditional write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookProcessor {

    private final PayoutGateway payoutGateway;
    private final WebhookEventStore eventStore;
    private final TransactionStore transactionStore;
    private final ObjectMapper objectMapper;
    private final PayoutMetrics payoutMetrics;
    private final Clock clock;

    public HandlerResult handle(byte[] rawPayload, String signature) throws IOException {
        if (signature == null || signature.isBlank()) {
            log.warn("Webhook rejected: missing signature");
            payoutMetrics.recordWebhook("missing_signature");
            return HandlerResult.missingSignature();
        }
        if (rawPayload == null || !payoutGateway.verifySignature(rawPayload, signature)) {
            log.warn("Webhook rejected: invalid signature");
            payoutMetrics.recordWebhook("invalid_signature");
            return HandlerResult.invalidSignature();
        }

        PayoutWebhookEvent event;
        try {
            event = objectMapper.readValue(rawPayload, PayoutWebhookEvent.class);
        } catch (JsonProcessingException e) {
            // Signed but unreadable: acknowledge so the sender stops, the reconciler picks up the payout.
            log.error("Webhook payload could not be parsed: error={}", e.getOriginalMessage());
            payoutMetrics.recordWebhook("malformed");
            return HandlerResult.handled(null, WebhookOutcome.FAILED, null, "Malformed payload");
        }

        String eventId = WebhookEventIdGenerator.eventId(
                event.accountId(), event.event(), event.payoutId(), event.createdAt());

        if (eventStore.findByEventId(eventId).isPresent()) {
            log.info("Duplicate webhook delivery ignored: eventId={}, event={}", eventId, event.event());
            payoutMetrics.recordWebhook("duplicate");
            return HandlerResult.duplicate(eventId);
        }

        WebhookEventRecord record = WebhookEventRecord.received(eventId, event.event(),
                WebhookEventIdGenerator.payloadHash(rawPayload), event.payoutId(), clock.instant());
        StoreResult<WebhookEventRecord> inserted = eventStore.create(record);
        if (inserted.getKind() == StoreResult.Kind.ALREADY_EXISTS) {
            payoutMetrics.recordWebhook("duplicate");
            return HandlerResult.duplicate(eventId);
        }
        inserted.orElseThrow();

        Outcome outcome;
        try {
            outcome = process(event);
        } catch (RuntimeException e) {
            log.error("Webhook processing failed: eventId={}, event={}", eventId, event.event(), e);
            outcome = new Outcome(WebhookOutcome.FAILED, null, e.getMessage());
        }

        eventStore.markProcessed(eventId, outcome.result(), outcome.transactionId(), outcome.note(), clock.instant());
        payoutMetrics.recordWebhook(outcome.result().name().toLowerCase());
        return HandlerResult.handled(eventId, outcome.result(), outcome.transactionId(), outcome.note());
    }

    private Outcome process(PayoutWebhookEvent event) {
        if (!ProcessorStatusMapper.isPayoutEvent(event.event()) || event.payoutEntity() == null) {
            log.info("Webhook event not handled: event={}", event.event());
            return new Outcome(WebhookOutcome.IGNORED, null, "Event type not handled: " + event.event());
        }

        PayoutEntity entity = event.payoutEntity();
        Optional<PayoutTransaction> found = findTransaction(entity);
        if (found.isEmpty()) {
            log.warn("Webhook for unknown payout: externalPayoutId={}, referenceId={}",
                    entity.id(), entity.referenceId());
            return new Outcome(WebhookOutcome.DISCREPANCY, null,
                    "No transaction for payout " + entity.id());
        }

        PayoutTransaction tx = found.get();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, tx.getTransactionId());
        try {
            return apply(event, tx, entity.toProcessorPayout());
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private Optional<PayoutTransaction> findTransaction(PayoutEntity entity) {
        Optional<PayoutTransaction> byExternalId = entity.id() == null
                ? Optional.empty()
                : transactionStore.getByExternalPayoutId(entity.id());
        if (byExternalId.isPresent() || entity.referenceId() == null) {
            return byExternalId;
        }
        // The webhook can beat the synchronous create response that stores the external id.
        return transactionStore.getByIdempotencyKey(entity.referenceId());
    }

    private Outcome apply(PayoutWebhookEvent event, PayoutTransaction tx, ProcessorPayout payout) {
        String status = payout.getStatus() != null ? payout.getStatus() : ProcessorStatusMapper.statusOfEvent(event.event());
        Optional<TransactionState> mapped = ProcessorStatusMapper.toState(status);
        if (mapped.isEmpty()) {
            log.warn("Webhook carries unrecognized status: status={}, state={}", status, tx.getState());
            return new Outcome(WebhookOutcome.DISCREPANCY, tx.getTransactionId(), "Unrecognized processor status: " + status);
        }

        TransactionState target = mapped.get();
        if (target == tx.getState()) {
            log.debug("Webhook status already applied: state={}", target);
            return new Outcome(WebhookOutcome.NO_OP, tx.getTransactionId(), null);
        }
        if (!TransactionStateMachine.isValidTransition(tx.getState(), target)) {
            log.warn("Webhook transition not allowed: from={}, to={}, event={}", tx.getState(), target, event.event());
            return new Outcome(WebhookOutcome.DISCREPANCY, tx.getTransactionId(),
                    "Invalid transition from " + tx.getState().getValue() + " to " + target.getValue());
        }

        Map<String, String> metadata = new HashMap<>();
        metadata.put("event", event.event());
        if (payout.getId() != null) {
            metadata.put("external_payout_id", payout.getId());
        }
        StateTransition transition = StateTransition.builder()
                .from(tx.getState())
                .to(target)
                .timestamp(clock.instant())
                .source(TransitionSource.WEBHOOK)
                .reason("Webhook " + event.event())
                .metadata(metadata)
                .build();
        TransactionFieldUpdates updates = payout.toFieldUpdates(target).clearNextRetryAt(true).build();

        StoreResult<PayoutTransaction> applied = transactionStore.applyTransition(
                tx.getTransactionId(), tx.getState(), transition, updates);
        if (!applied.isOk()) {
            log.warn("Webhook transition not applied: from={}, to={}, result={}", tx.getState(), target, applied);
            return new Outcome(WebhookOutcome.FAILED, tx.getTransactionId(), "Transition not applied: " + applied);
        }
        return new Outcome(WebhookOutcome.APPLIED, tx.getTransactionId(), null);
    }

    private record Outcome(WebhookOutcome result, String transactionId, String note) {}
}
