package com.flagship.payout_engine.webhook;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One inbound, signature-verified webhook event.
 *
 * Created unprocessed before any business change is made, then marked
 * processed with its outcome. The unique eventId is what stops a second
 * delivery of the same event from being applied twice.
 */
@Value
@Builder(toBuilder = true)
public class WebhookEventRecord {
    String eventId;
    String eventType;
    String payloadHash;
    String externalPayoutId;
    boolean processed;
    WebhookOutcome outcome;
    String transactionId;
    String error;
    Instant receivedAt;
    Instant processedAt;

    public static WebhookEventRecord received(String eventId, String eventType, String payloadHash,
                                              String externalPayoutId, Instant receivedAt) {
        return WebhookEventRecord.builder()
                .eventId(eventId)
                .eventType(eventType)
                .payloadHash(payloadHash)
                .externalPayoutId(externalPayoutId)
                .processed(false)
                .receivedAt(receivedAt)
                .build();
    }
}
