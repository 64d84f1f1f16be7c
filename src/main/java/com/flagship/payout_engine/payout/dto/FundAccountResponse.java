package com.flagship.payout_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_engine.payout.FundAccount;

/**
 * Caller-facing view of a fund account. The full account number is never returned.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FundAccountResponse(
        @JsonProperty("reference") String reference,
        @JsonProperty("account_type") String accountType,
        @JsonProperty("holder_name") String holderName,
        @JsonProperty("ifsc") String ifsc,
        @JsonProperty("account_number_last4") String accountNumberLast4,
        @JsonProperty("vpa") String vpa,
        @JsonProperty("active") boolean active) {

    public static FundAccountResponse from(FundAccount account) {
        return new FundAccountResponse(
                account.getReference(),
                account.getAccountType() == FundAccount.AccountType.VPA ? "vpa" : "bank_account",
                account.getBeneficiaryName(),
                account.getIfsc(),
                account.getAccountNumberLast4(),
                account.getVpaAddress(),
                account.isActive());
    }
}
