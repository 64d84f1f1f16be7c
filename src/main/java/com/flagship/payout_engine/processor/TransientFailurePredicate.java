package com.flagship.payout_engine.processor;

import java.util.function.Predicate;

/**
 * Decides which processor failures count against the circuit breaker.
 *
 * A rejected payout (4xx) says nothing about the processor's health, so only
 * transient failures are recorded.
 */
public class TransientFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof PayoutGatewayException e) {
            return e.isTransient();
        }
        return true;
    }
}
