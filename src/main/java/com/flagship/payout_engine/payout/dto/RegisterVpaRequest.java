package com.flagship.payout_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record RegisterVpaRequest(
        @NotBlank(message = "Account holder name is required")
        @JsonProperty("holder_name")
        String holderName,

        @NotBlank(message = "UPI address is required")
        @JsonProperty("vpa")
        String vpa,

        @Email(message = "Email must be valid")
        @JsonProperty("email")
        String email,

        @JsonProperty("phone")
        String phone) {
}
