package com.flagship.payout_engine.processor;

import com.flagship.payout_engine.transaction.TransactionState;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps processor payout statuses onto transaction states.
 *
 * Shared by submission, retries, webhooks and reconciliation so that every
 * entry point reads the processor the same way. An unrecognised status maps
 * to empty: the caller keeps the current state and reports a discrepancy.
 */
public final class ProcessorStatusMapper {

    private static final String PAYOUT_EVENT_PREFIX = "payout.";

    private static final Map<String, TransactionState> STATUS_MAP = Map.of(
            "queued", TransactionState.QUEUED,
            "pending", TransactionState.PENDING,
            "processing", TransactionState.PROCESSING,
            "processed", TransactionState.COMPLETED,
            "reversed", TransactionState.REVERSED,
            "cancelled", TransactionState.CANCELLED,
            "rejected", TransactionState.FAILED,
            "failed", TransactionState.FAILED
    );

    private ProcessorStatusMapper() {
        // Utility class
    }

    public static Optional<TransactionState> toState(String processorStatus) {
        if (processorStatus == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(STATUS_MAP.get(processorStatus.trim().toLowerCase(Locale.ROOT)));
    }

    public static boolean isPayoutEvent(String eventType) {
        return eventType != null && eventType.startsWith(PAYOUT_EVENT_PREFIX);
    }

    /**
     * "payout.processed" -> "processed".
     */
    public static String statusOfEvent(String eventType) {
        return isPayoutEvent(eventType) ? eventType.substring(PAYOUT_EVENT_PREFIX.length()) : null;
    }
}
