package com.flagship.payout_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for registering a bank account. IFSC and account number
 * formats are checked by the service after normalisation.
 */
public record RegisterBankAccountRequest(
        @NotBlank(message = "Account holder name is required")
        @JsonProperty("holder_name")
        String holderName,

        @NotBlank(message = "IFSC is required")
        @JsonProperty("ifsc")
        String ifsc,

        @NotBlank(message = "Account number is required")
        @JsonProperty("account_number")
        String accountNumber,

        @Email(message = "Email must be valid")
        @JsonProperty("email")
        String email,

        @JsonProperty("phone")
        String phone) {
}
