package com.flagship.payout_engine.processor;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProcessorContact {
    String id;
    String referenceId;
    boolean active;
}
