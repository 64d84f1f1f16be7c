package com.flagship.payout_engine.retry;

import com.flagship.payout_engine.config.PayoutProperties;

import java.time.Duration;

/**
 * Exponential backoff with a ceiling.
 *
 * delay(k) = min(initialDelay * multiplier^k, maxDelay), where k is the
 * number of failed resubmissions so far. With the defaults the delays are
 * 60s, 120s and 240s.
 */
public final class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    public BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier) {
        if (initialDelay.isNegative() || maxDelay.isNegative() || multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff needs non-negative delays and a multiplier >= 1");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
    }

    public static BackoffPolicy from(PayoutProperties.Retry retry) {
        return new BackoffPolicy(retry.getInitialDelay(), retry.getMaxDelay(), retry.getBackoffMultiplier());
    }

    public Duration delayFor(int failedAttempts) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempts));
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
