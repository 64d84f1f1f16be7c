package com.flagship.payout_engine.reconciliation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReconciliationSummary {
    int checked;
    int reconciled;
    int updated;
    int discrepancies;
    int conflicts;
    int failed;
    @Singular
    List<String> errors;
}
