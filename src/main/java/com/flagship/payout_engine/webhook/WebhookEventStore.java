package com.flagship.payout_engine.webhook;

import com.flagship.payout_engine.transaction.StoreResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface WebhookEventStore {

    Optional<WebhookEventRecord> findByEventId(String eventId);

    /**
     * Inserts an unprocessed record. ALREADY_EXISTS when another delivery
     * of the same event won the insert.
     */
    StoreResult<WebhookEventRecord> create(WebhookEventRecord record);

    void markProcessed(String eventId, WebhookOutcome outcome, String transactionId, String error, Instant at);

    List<WebhookEventRecord> findByExternalPayoutId(String externalPayoutId);
}
