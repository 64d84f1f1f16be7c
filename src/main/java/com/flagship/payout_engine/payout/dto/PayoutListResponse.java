package com.flagship.payout_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_engine.transaction.TransactionPage;
import lombok.Value;

import java.util.List;

@Value
public class PayoutListResponse {

    @JsonProperty("items")
    List<PayoutResponse> items;

    @JsonProperty("total")
    long total;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("offset")
    int offset;

    public static PayoutListResponse from(TransactionPage page) {
        return new PayoutListResponse(
                page.getItems().stream().map(PayoutResponse::from).toList(),
                page.getTotal(),
                page.getLimit(),
                page.getOffset());
    }
}
