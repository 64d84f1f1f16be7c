package com.flagship.payout_engine.transaction;

import com.flagship.payout_engine.support.TestPayouts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PayoutTransactionTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("A new payout starts in initiated with one self-record")
    void testInitiate() {
        PayoutTransaction tx = TestPayouts.initiated("txn_1", T0);

        assertEquals(TransactionState.INITIATED, tx.getState());
        assertNull(tx.getPreviousState());
        assertEquals(1, tx.getStateHistory().size());
        assertTrue(tx.getStateHistory().get(0).isSelfRecord());
        assertEquals(TransitionSource.USER, tx.getStateHistory().get(0).getSource());
        assertEquals(0, tx.getRetryCount());
        assertEquals(T0, tx.getCreatedAt());
    }

    @Test
    @DisplayName("Transitions append history and stamp timestamps once")
    void testTransitionStampsTimestamps() {
        PayoutTransaction tx = TestPayouts.initiated("txn_1", T0);
        Instant t1 = T0.plusSeconds(1);
        Instant t2 = T0.plusSeconds(60);

        tx = tx.withTransition(StateTransition.of(TransactionState.INITIATED, TransactionState.QUEUED, t1,
                        TransitionSource.SYSTEM, "accepted"),
                TransactionFieldUpdates.builder().externalPayoutId("pout_1").submittedAt(t1).build());
        tx = tx.withTransition(StateTransition.of(TransactionState.QUEUED, TransactionState.PENDING, t2,
                        TransitionSource.WEBHOOK, "pending"),
                TransactionFieldUpdates.builder().externalPayoutId("pout_other").submittedAt(t2).build());

        assertEquals(TransactionState.PENDING, tx.getState());
        assertEquals(TransactionState.QUEUED, tx.getPreviousState());
        assertEquals(3, tx.getStateHistory().size());
        assertEquals("pout_1", tx.getExternalPayoutId(), "external id is set once");
        assertEquals(t1, tx.getSubmittedAt(), "submittedAt is set once");
        assertEquals(t2, tx.getUpdatedAt());
    }

    @Test
    @DisplayName("Completion keeps completedAt when the payout is later reversed")
    void testReversalAfterCompletion() {
        PayoutTransaction tx = TestPayouts.inState("txn_1", TransactionState.PROCESSING, "pout_1", T0);
        Instant done = T0.plusSeconds(30);
        Instant reversed = T0.plus(Duration.ofDays(1));

        tx = tx.withTransition(StateTransition.of(TransactionState.PROCESSING, TransactionState.COMPLETED, done,
                TransitionSource.WEBHOOK, "processed"), TransactionFieldUpdates.builder().utr("UTR1").build());
        tx = tx.withTransition(StateTransition.of(TransactionState.COMPLETED, TransactionState.REVERSED, reversed,
                TransitionSource.WEBHOOK, "reversed"), TransactionFieldUpdates.none());

        assertEquals(TransactionState.REVERSED, tx.getState());
        assertEquals(done, tx.getCompletedAt());
        assertEquals(reversed, tx.getFailedAt());
        assertEquals("UTR1", tx.getUtr());
    }

    @Test
    @DisplayName("A refund request after completion also keeps completedAt")
    void testRefundAfterCompletion() {
        PayoutTransaction tx = TestPayouts.inState("txn_1", TransactionState.PROCESSING, "pout_1", T0);
        Instant done = T0.plusSeconds(30);

        tx = tx.withTransition(StateTransition.of(TransactionState.PROCESSING, TransactionState.COMPLETED, done,
                TransitionSource.WEBHOOK, "processed"), TransactionFieldUpdates.none());
        tx = tx.withTransition(StateTransition.of(TransactionState.COMPLETED, TransactionState.REFUND_PENDING,
                T0.plus(Duration.ofHours(2)), TransitionSource.USER, "refund requested"), TransactionFieldUpdates.none());

        assertEquals(TransactionState.REFUND_PENDING, tx.getState());
        assertEquals(done, tx.getCompletedAt());
        assertNull(tx.getFailedAt());
    }

    @Test
    @DisplayName("Entering a terminal state clears nextRetryAt")
    void testTerminalClearsNextRetry() {
        PayoutTransaction tx = TestPayouts.initiated("txn_1", T0);
        tx = tx.withTransition(StateTransition.of(TransactionState.INITIATED, TransactionState.SUBMITTED, T0,
                TransitionSource.SYSTEM, "deferred"),
                TransactionFieldUpdates.builder().retryCount(0).nextRetryAt(T0.plusSeconds(60)).build());
        assertEquals(T0.plusSeconds(60), tx.getNextRetryAt());

        tx = tx.withTransition(StateTransition.of(TransactionState.SUBMITTED, TransactionState.FAILED, T0,
                TransitionSource.SYSTEM, "exhausted"),
                TransactionFieldUpdates.builder().retryCount(3).nextRetryAt(T0.plusSeconds(600)).build());

        assertNull(tx.getNextRetryAt());
        assertEquals(T0, tx.getFailedAt());
    }

    @Test
    @DisplayName("A retry count above maxRetries is refused")
    void testRetryCountBounded() {
        PayoutTransaction tx = TestPayouts.inState("txn_1", TransactionState.SUBMITTED, null, T0);
        StateTransition record = StateTransition.of(TransactionState.SUBMITTED, TransactionState.SUBMITTED, T0,
                TransitionSource.SYSTEM, "attempt");

        assertThrows(IllegalArgumentException.class,
                () -> tx.withTransition(record, TransactionFieldUpdates.builder().retryCount(4).build()));
    }

    @Test
    @DisplayName("A transition must start at the current state and be recordable")
    void testTransitionGuards() {
        PayoutTransaction queued = TestPayouts.inState("txn_1", TransactionState.QUEUED, "pout_1", T0);
        PayoutTransaction failed = TestPayouts.inState("txn_2", TransactionState.FAILED, "pout_2", T0);

        assertThrows(IllegalStateException.class, () -> queued.withTransition(
                StateTransition.of(TransactionState.PENDING, TransactionState.COMPLETED, T0,
                        TransitionSource.WEBHOOK, "wrong start"), TransactionFieldUpdates.none()));
        assertThrows(IllegalStateException.class, () -> queued.withTransition(
                StateTransition.of(TransactionState.QUEUED, TransactionState.COMPLETED, T0,
                        TransitionSource.WEBHOOK, "skips pending"), TransactionFieldUpdates.none()));
        assertThrows(IllegalStateException.class, () -> failed.withTransition(
                StateTransition.of(TransactionState.FAILED, TransactionState.FAILED, T0,
                        TransitionSource.SYSTEM, "audit"), TransactionFieldUpdates.none()));
    }
}
