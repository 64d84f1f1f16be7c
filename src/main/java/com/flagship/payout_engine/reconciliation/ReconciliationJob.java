package com.flagship.payout_engine.reconciliation;

import com.flagship.payout_engine.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic trigger for {@link Reconciler#reconcileAllPending()}.
 */
@Component
@ConditionalOnProperty(name = "payout.reconciliation.scheduler-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReconciliationJob {

    private final Reconciler reconciler;

    @Scheduled(fixedDelayString = "${payout.reconciliation.poll-interval:PT5M}",
               initialDelayString = "${payout.reconciliation.poll-interval:PT5M}")
    public void run() {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        try {
            reconciler.reconcileAllPending();
        } catch (RuntimeException e) {
            log.error("Reconciliation run aborted", e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }
}
