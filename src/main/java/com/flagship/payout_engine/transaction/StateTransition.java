package com.flagship.payout_engine.transaction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of a transaction's append-only state history.
 */
@Value
@Builder
@Jacksonized
public class StateTransition {
    TransactionState from;
    TransactionState to;
    Instant timestamp;
    String reason;
    TransitionSource source;
    Map<String, String> metadata;

    public Map<String, String> getMetadata() {
        return metadata == null ? Map.of() : metadata;
    }

    @JsonIgnore
    public boolean isSelfRecord() {
        return from == to;
    }

    public static StateTransition of(TransactionState from, TransactionState to, Instant timestamp,
                                     TransitionSource source, String reason) {
        return StateTransition.builder()
                .from(from)
                .to(to)
                .timestamp(timestamp)
                .source(source)
                .reason(reason)
                .build();
    }
}
