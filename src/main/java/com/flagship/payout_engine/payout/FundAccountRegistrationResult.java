package com.flagship.payout_engine.payout;

import lombok.Value;

@Value
public class FundAccountRegistrationResult {
    FundAccount fundAccount;
    boolean created;
}
