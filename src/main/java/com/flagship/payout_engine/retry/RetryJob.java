package com.flagship.payout_engine.retry;

import com.flagship.payout_engine.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic trigger for {@link RetryScheduler}.
 * Disabled with payout.retry.scheduler-enabled=false.
 */
@Component
@ConditionalOnProperty(name = "payout.retry.scheduler-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RetryJob {

    private final RetryScheduler retryScheduler;

    @Scheduled(fixedDelayString = "${payout.retry.poll-interval:PT30S}",
               initialDelayString = "${payout.retry.poll-interval:PT30S}")
    public void run() {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        try {
            retryScheduler.processRetries();
        } catch (RuntimeException e) {
            log.error("Retry run aborted", e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }
}
