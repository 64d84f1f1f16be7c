package com.flagship.payout_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Request body for creating a payout. amount is in paise.
 */
public record CreatePayoutRequest(
        @NotBlank(message = "User ID is required")
        @JsonProperty("user_id")
        String userId,

        @NotBlank(message = "Fund account reference is required")
        @JsonProperty("fund_account_ref")
        String fundAccountRef,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be greater than 0")
        @JsonProperty("amount")
        Long amount,

        @NotBlank(message = "Mode is required")
        @JsonProperty("mode")
        String mode,

        @NotBlank(message = "Purpose is required")
        @JsonProperty("purpose")
        String purpose,

        @JsonProperty("type")
        String type,

        @Size(max = 30, message = "Narration must be at most 30 characters")
        @JsonProperty("narration")
        String narration,

        @JsonProperty("metadata")
        Map<String, String> metadata) {
}
