package com.flagship.payout_engine.processor;

import lombok.Builder;
import lombok.Value;

/**
 * A bank account or VPA to register under a processor contact.
 * Bank fields are set for {@code bank_account}, vpaAddress for {@code vpa}.
 */
@Value
@Builder
public class CreateFundAccountCommand {

    public static final String BANK_ACCOUNT = "bank_account";
    public static final String VPA = "vpa";

    String contactId;
    String accountType;
    String holderName;
    String ifsc;
    String accountNumber;
    String vpaAddress;
}
