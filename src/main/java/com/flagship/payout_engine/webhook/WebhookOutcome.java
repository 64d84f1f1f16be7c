package com.flagship.payout_engine.webhook;

/**
 * How a recorded webhook event was handled.
 */
public enum WebhookOutcome {
    /** A transition was applied. */
    APPLIED,
    /** The transaction was already in the reported state. */
    NO_OP,
    /** The event could not be applied safely; kept for operators and the reconciler. */
    DISCREPANCY,
    /** Not a payout lifecycle event. */
    IGNORED,
    /** Processing threw; the reconciler is the backstop. */
    FAILED
}
