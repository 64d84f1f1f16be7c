package com.flagship.payout_engine.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the payout lifecycle.
 *
 * Metrics exposed:
 * - payout.submissions: submissions by mode and outcome
 * - payout.transitions: applied transitions by source and target state
 * - payout.webhooks: webhook deliveries by outcome
 * - payout.retries: resubmission attempts by outcome
 * - payout.reconciliations: reconciliation checks by outcome
 * - payout.processor.latency: processor call latency by operation and outcome
 * - idempotency.cache: submission key lookups by hit/miss
 */
@Component
public class PayoutMetrics {

    private final MeterRegistry registry;

    public PayoutMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSubmission(String mode, String outcome) {
        registry.counter("payout.submissions",
                "mode", sanitizeTag(mode),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordTransition(String source, String toState) {
        registry.counter("payout.transitions",
                "source", sanitizeTag(source),
                "to", sanitizeTag(toState)
        ).increment();
    }

    public void recordWebhook(String outcome) {
        registry.counter("payout.webhooks", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordRetry(String outcome) {
        registry.counter("payout.retries", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordReconciliation(String outcome) {
        registry.counter("payout.reconciliations", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordProcessorCall(String operation, String outcome, Duration duration) {
        registry.timer("payout.processor.latency",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(duration);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
