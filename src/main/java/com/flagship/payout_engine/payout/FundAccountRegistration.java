package com.flagship.payout_engine.payout;

import lombok.Builder;
import lombok.Value;

/**
 * A request to register a bank account or VPA for a user.
 * email and phone are only used when the user has no processor contact yet.
 */
@Value
@Builder(toBuilder = true)
public class FundAccountRegistration {
    String userId;
    FundAccount.AccountType accountType;
    String holderName;
    String email;
    String phone;
    String ifsc;
    String accountNumber;
    String vpaAddress;
}
