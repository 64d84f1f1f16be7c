package com.flagship.payout_engine.payout.exception;

public class FundAccountNotFoundException extends RuntimeException {

    public FundAccountNotFoundException(String reference) {
        super("Fund account not found: " + reference);
    }
}
