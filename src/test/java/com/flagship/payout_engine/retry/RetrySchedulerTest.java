package com.flagship.payout_engine.retry;

import com.flagship.payout_engine.config.PayoutProperties;
import com.flagship.payout_engine.observability.PayoutMetrics;
import com.flagship.payout_engine.processor.PayoutGatewayException;
import com.flagship.payout_engine.support.FakePayoutGateway;
import com.flagship.payout_engine.support.InMemoryTransactionStore;
import com.flagship.payout_engine.support.MutableClock;
import com.flagship.payout_engine.support.TestPayouts;
import com.flagship.payout_engine.transaction.FailureReason;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.StoreResult;
import com.flagship.payout_engine.transaction.TransactionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RetrySchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryTransactionStore store;
    private FakePayoutGateway gateway;
    private SimpleMeterRegistry meterRegistry;
    private RetryScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryTransactionStore();
        gateway = new FakePayoutGateway();
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new RetryScheduler(store, gateway, new PayoutProperties(),
                new PayoutMetrics(meterRegistry), clock);
    }

    /**
     * A payout whose first submission timed out, as the submitter leaves it.
     */
    private PayoutTransaction deferred(String transactionId) {
        return store.put(TestPayouts.inState(transactionId, TransactionState.SUBMITTED, null, NOW).toBuilder()
                .retryCount(0)
                .nextRetryAt(NOW.plusSeconds(60))
                .build());
    }

    private static PayoutGatewayException unavailable() {
        return PayoutGatewayException.transientFailure("Processor create failed with HTTP 503", 503, null);
    }

    @Test
    @DisplayName("Nothing is resubmitted before the retry time")
    void testNotDueYet() {
        deferred("txn_1");
        clock.advance(Duration.ofSeconds(59));

        RetryRunSummary summary = scheduler.processRetries();

        assertEquals(0, summary.getProcessed());
        assertTrue(gateway.createCalls().isEmpty());
    }

    @Test
    @DisplayName("Due payout is resubmitted with its original reference id")
    void testResubmitWithSameReference() {
        PayoutTransaction tx = deferred("txn_1");
        gateway.answerCreateWithStatus("queued");
        clock.advance(Duration.ofSeconds(60));

        RetryRunSummary summary = scheduler.processRetries();

        assertEquals(1, summary.getSucceeded());
        assertEquals(tx.getIdempotencyKey(), gateway.createCalls().get(0).getReferenceId());
        PayoutTransaction stored = store.require("txn_1");
        assertEquals(TransactionState.QUEUED, stored.getState());
        assertEquals(gateway.lastPayoutId(), stored.getExternalPayoutId());
        assertNull(stored.getNextRetryAt());
        assertEquals("1", stored.getStateHistory().get(stored.getStateHistory().size() - 1)
                .getMetadata().get("attempt"));
    }

    @Test
    @DisplayName("Three failed resubmissions exhaust the budget with growing delays")
    void testRetriesExhausted() {
        deferred("txn_1");
        gateway.answerCreateWith(unavailable())
                .answerCreateWith(unavailable())
                .answerCreateWith(PayoutGatewayException.timeout("Processor create timed out", null));

        clock.advance(Duration.ofSeconds(60));
        assertEquals(1, scheduler.processRetries().getRescheduled());
        PayoutTransaction afterFirst = store.require("txn_1");
        assertEquals(1, afterFirst.getRetryCount());
        assertEquals(clock.instant().plusSeconds(120), afterFirst.getNextRetryAt());

        clock.advance(Duration.ofSeconds(120));
        assertEquals(1, scheduler.processRetries().getRescheduled());
        PayoutTransaction afterSecond = store.require("txn_1");
        assertEquals(2, afterSecond.getRetryCount());
        assertEquals(clock.instant().plusSeconds(240), afterSecond.getNextRetryAt());

        clock.advance(Duration.ofSeconds(240));
        assertEquals(1, scheduler.processRetries().getFailed());
        PayoutTransaction failed = store.require("txn_1");
        assertEquals(TransactionState.FAILED, failed.getState());
        assertEquals(3, failed.getRetryCount());
        assertEquals(FailureReason.TIMEOUT, failed.getFailureReason());
        assertEquals(clock.instant(), failed.getFailedAt());
        assertNull(failed.getNextRetryAt());

        clock.advance(Duration.ofHours(1));
        assertEquals(0, scheduler.processRetries().getProcessed());
        assertEquals(3, gateway.createCalls().size());
    }

    @Test
    @DisplayName("A payout keeps the retry budget it was created with")
    void testRetryBudgetFromPayoutRow() {
        store.put(TestPayouts.inState("txn_1", TransactionState.SUBMITTED, null, NOW).toBuilder()
                .retryCount(0)
                .maxRetries(5)
                .nextRetryAt(NOW.plusSeconds(60))
                .build());
        for (int i = 0; i < 5; i++) {
            gateway.answerCreateWith(unavailable());
        }

        for (int tick = 0; tick < 6; tick++) {
            clock.advance(Duration.ofHours(1));
            scheduler.processRetries();
        }

        PayoutTransaction failed = store.require("txn_1");
        assertEquals(TransactionState.FAILED, failed.getState());
        assertEquals(5, failed.getRetryCount());
        assertEquals(FailureReason.NETWORK_ERROR, failed.getFailureReason());
        assertNull(failed.getNextRetryAt());
        assertEquals(5, gateway.createCalls().size());
    }

    @Test
    @DisplayName("Explicit rejection on resubmission fails the payout")
    void testRejectedOnRetry() {
        deferred("txn_1");
        gateway.answerCreateWith(PayoutGatewayException.permanent("bad fund account", 400, null));
        clock.advance(Duration.ofSeconds(60));

        RetryRunSummary summary = scheduler.processRetries();

        assertEquals(1, summary.getFailed());
        PayoutTransaction stored = store.require("txn_1");
        assertEquals(TransactionState.FAILED, stored.getState());
        assertEquals(FailureReason.PAYOUT_REJECTED, stored.getFailureReason());
    }

    @Test
    @DisplayName("A payout claimed by another worker is skipped")
    void testClaimedElsewhere() {
        deferred("txn_1");
        clock.advance(Duration.ofSeconds(60));

        StoreResult<PayoutTransaction> claimedByOther = store.claimForRetry(
                "txn_1", 0, clock.instant(), clock.instant().plus(Duration.ofMinutes(5)));
        StoreResult<PayoutTransaction> secondClaim = store.claimForRetry(
                "txn_1", 0, clock.instant(), clock.instant().plus(Duration.ofMinutes(5)));

        assertTrue(claimedByOther.isOk());
        assertEquals(StoreResult.Kind.CONFLICT, secondClaim.getKind());
        assertEquals(0, scheduler.processRetries().getProcessed());
        assertTrue(gateway.createCalls().isEmpty());
    }

    @Test
    @DisplayName("Payouts the processor already accepted are never resubmitted")
    void testAcceptedPayoutsNotRetried() {
        for (TransactionState state : new TransactionState[]{
                TransactionState.QUEUED, TransactionState.PENDING, TransactionState.PROCESSING}) {
            store.put(TestPayouts.inState("txn_" + state.getValue(), state, "pout_" + state.getValue(), NOW)
                    .toBuilder()
                    .nextRetryAt(NOW)
                    .build());
        }
        clock.advance(Duration.ofHours(1));

        RetryRunSummary summary = scheduler.processRetries();

        assertEquals(0, summary.getProcessed());
        assertTrue(gateway.createCalls().isEmpty());
    }

    @Test
    @DisplayName("Each due payout in a batch gets its own outcome")
    void testBatchOutcomes() {
        deferred("txn_1");
        deferred("txn_2");
        gateway.answerCreateWithStatus("queued")
                .answerCreateWith(PayoutGatewayException.permanent("rejected", 422, null));
        clock.advance(Duration.ofSeconds(60));

        RetryRunSummary summary = scheduler.processRetries();

        assertEquals(2, summary.getProcessed());
        assertEquals(1, summary.getSucceeded());
        assertEquals(1, summary.getFailed());
        assertTrue(summary.getErrors().isEmpty());
        assertEquals(2.0, meterRegistry.get("payout.retries").counters().stream()
                .mapToDouble(c -> c.count()).sum());
    }
}
