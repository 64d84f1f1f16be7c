package com.flagship.payout_engine.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for webhook_events. The primary key is the derived event id,
 * so a duplicate insert fails on the constraint.
 */
@Entity
@Table(name = "webhook_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WebhookEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false, length = 64)
    private String eventId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "payload_hash", nullable = false, updatable = false, length = 64)
    private String payloadHash;

    @Column(name = "external_payout_id", updatable = false, length = 64)
    private String externalPayoutId;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 20)
    private WebhookOutcome outcome;

    @Column(name = "transaction_id", length = 64)
    private String transactionId;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    static WebhookEventEntity fromDomain(WebhookEventRecord record) {
        WebhookEventEntity entity = new WebhookEventEntity();
        entity.eventId = record.getEventId();
        entity.eventType = record.getEventType();
        entity.payloadHash = record.getPayloadHash();
        entity.externalPayoutId = record.getExternalPayoutId();
        entity.processed = record.isProcessed();
        entity.outcome = record.getOutcome();
        entity.transactionId = record.getTransactionId();
        entity.error = record.getError();
        entity.receivedAt = record.getReceivedAt();
        entity.processedAt = record.getProcessedAt();
        return entity;
    }

    WebhookEventRecord toDomain() {
        return WebhookEventRecord.builder()
                .eventId(eventId)
                .eventType(eventType)
                .payloadHash(payloadHash)
                .externalPayoutId(externalPayoutId)
                .processed(processed)
                .outcome(outcome)
                .transactionId(transactionId)
                .error(error)
                .receivedAt(receivedAt)
                .processedAt(processedAt)
                .build();
    }

    void markProcessed(WebhookOutcome outcome, String transactionId, String error, Instant processedAt) {
        this.processed = true;
        this.outcome = outcome;
        this.transactionId = transactionId;
        this.error = error;
        this.processedAt = processedAt;
    }
}
