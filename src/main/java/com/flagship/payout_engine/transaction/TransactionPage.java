package com.flagship.payout_engine.transaction;

import lombok.Value;

import java.util.List;

@Value
public class TransactionPage {
    List<PayoutTransaction> items;
    long total;
    int limit;
    int offset;
}
