package com.flagship.payout_engine.payout;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.TransactionState;
import lombok.Builder;
import lombok.Value;

/**
 * What a caller learns from a submission.
 *
 * success=false with a transaction id means the payout exists and can be
 * polled; success=false without one means validation rejected it and
 * nothing was stored.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PayoutSubmissionResult {

    public enum ErrorCode {
        INVALID_REQUEST,
        INVALID_AMOUNT,
        FUND_ACCOUNT_NOT_FOUND,
        FUND_ACCOUNT_INACTIVE,
        FUND_ACCOUNT_NOT_OWNED,
        PROCESSOR_REJECTED,
        PROCESSOR_UNAVAILABLE,
        CONFLICT
    }

    boolean success;
    String transactionId;
    String externalPayoutId;
    TransactionState state;
    String error;
    ErrorCode errorCode;
    boolean duplicate;

    static PayoutSubmissionResult rejected(ErrorCode code, String error) {
        return PayoutSubmissionResult.builder()
                .success(false)
                .errorCode(code)
                .error(error)
                .build();
    }

    static PayoutSubmissionResult of(PayoutTransaction tx, boolean success, ErrorCode code, String error) {
        return PayoutSubmissionResult.builder()
                .success(success)
                .transactionId(tx.getTransactionId())
                .externalPayoutId(tx.getExternalPayoutId())
                .state(tx.getState())
                .errorCode(code)
                .error(error)
                .build();
    }
}
