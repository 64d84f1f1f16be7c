package com.flagship.payout_engine.transaction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.flagship.payout_engine.transaction.TransactionState.*;

/**
 * Transition rules for payout transactions.
 *
 * Pure table lookups, no I/O. The table is permissive about which processor
 * signal may reach which state, because the processor vocabulary does not map
 * one to one onto ours and signals arrive out of order. It is strict about
 * terminal states: FAILED, REVERSED, CANCELLED and REFUND_COMPLETED have no
 * outgoing edges. COMPLETED only leaves towards REVERSED or REFUND_PENDING.
 */
public final class TransactionStateMachine {

    private static final Map<TransactionState, Set<TransactionState>> TRANSITIONS =
            new EnumMap<>(TransactionState.class);

    private static final Set<TransactionState> TERMINAL_STATES =
            Collections.unmodifiableSet(EnumSet.of(FAILED, REVERSED, CANCELLED, REFUND_COMPLETED));

    static {
        TRANSITIONS.put(INITIATED, EnumSet.of(SUBMITTED, QUEUED, PENDING, FAILED, CANCELLED));
        TRANSITIONS.put(SUBMITTED, EnumSet.of(QUEUED, PENDING, FAILED, CANCELLED));
        TRANSITIONS.put(QUEUED, EnumSet.of(PENDING, PROCESSING, CANCELLED, FAILED));
        TRANSITIONS.put(PENDING, EnumSet.of(PROCESSING, COMPLETED, FAILED, REVERSED));
        TRANSITIONS.put(PROCESSING, EnumSet.of(COMPLETED, FAILED, REVERSED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(REVERSED, REFUND_PENDING));
        TRANSITIONS.put(REFUND_PENDING, EnumSet.of(REFUND_COMPLETED, FAILED));
        for (TransactionState terminal : TERMINAL_STATES) {
            TRANSITIONS.put(terminal, EnumSet.noneOf(TransactionState.class));
        }
    }

    private TransactionStateMachine() {
        // Utility class
    }

    public static boolean isValidTransition(TransactionState from, TransactionState to) {
        if (from == null || to == null) {
            return false;
        }
        return TRANSITIONS.get(from).contains(to);
    }

    public static boolean isTerminal(TransactionState state) {
        return TERMINAL_STATES.contains(state);
    }

    public static Set<TransactionState> allowedTransitions(TransactionState from) {
        return Collections.unmodifiableSet(TRANSITIONS.get(from));
    }

    public static Set<TransactionState> terminalStates() {
        return TERMINAL_STATES;
    }

    /**
     * Whether a history entry from {@code from} to {@code to} may be recorded.
     *
     * A self-record keeps the state and only documents an event (the initial
     * record, a failed resubmission, an unrecognised processor status). It is
     * refused on terminal states so that they stay frozen.
     */
    public static boolean isRecordable(TransactionState from, TransactionState to) {
        if (from != null && from == to) {
            return !isTerminal(from);
        }
        return isValidTransition(from, to);
    }
}
