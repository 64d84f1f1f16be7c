package com.flagship.payout_engine.payout;

import lombok.Builder;
import lombok.Value;

/**
 * A payee's bank account or VPA registered with the processor.
 * Only the last four digits of a bank account number are kept.
 */
@Value
@Builder
public class FundAccount {

    public enum AccountType {
        BANK_ACCOUNT,
        VPA
    }

    String reference;
    String userId;
    String processorFundAccountId;
    String processorContactId;
    AccountType accountType;
    String beneficiaryName;
    String ifsc;
    String accountNumberLast4;
    String vpaAddress;
    boolean active;

    public boolean isOwnedBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }
}
