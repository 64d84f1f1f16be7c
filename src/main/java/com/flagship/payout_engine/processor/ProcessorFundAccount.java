package com.flagship.payout_engine.processor;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProcessorFundAccount {
    String id;
    String contactId;
    String accountType;
    boolean active;
}
