package com.flagship.payout_engine.webhook;

import com.flagship.payout_engine.transaction.StoreResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Each call runs in its own short transaction. The insert in particular must
 * commit before any business change so that it works as a mutual-exclusion
 * device between concurrent deliveries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaWebhookEventStore implements WebhookEventStore {

    private final WebhookEventRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<WebhookEventRecord> findByEventId(String eventId) {
        return repository.findById(eventId).map(WebhookEventEntity::toDomain);
    }

    @Override
    public StoreResult<WebhookEventRecord> create(WebhookEventRecord record) {
        try {
            return StoreResult.ok(repository.saveAndFlush(WebhookEventEntity.fromDomain(record)).toDomain());
        } catch (DataIntegrityViolationException e) {
            log.info("Webhook event already recorded by a concurrent delivery: eventId={}", record.getEventId());
            return StoreResult.alreadyExists("Webhook event " + record.getEventId() + " already recorded");
        }
    }

    @Override
    @Transactional
    public void markProcessed(String eventId, WebhookOutcome outcome, String transactionId, String error, Instant at) {
        WebhookEventEntity entity = repository.findById(eventId)
                .orElseThrow(() -> new IllegalStateException("Webhook event not recorded: " + eventId));
        entity.markProcessed(outcome, transactionId, error, at);
        repository.save(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WebhookEventRecord> findByExternalPayoutId(String externalPayoutId) {
        return repository.findByExternalPayoutIdOrderByReceivedAtAsc(externalPayoutId)
                .stream()
                .map(WebhookEventEntity::toDomain)
                .toList();
    }
}
