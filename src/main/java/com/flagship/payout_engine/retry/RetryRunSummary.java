package com.flagship.payout_engine.retry;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Counts for one retry run.
 *
 * processed = succeeded + failed + rescheduled + skipped + errors.size()
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RetryRunSummary {
    int processed;
    int succeeded;
    int failed;
    int rescheduled;
    int skipped;
    @Singular
    List<String> errors;
}
