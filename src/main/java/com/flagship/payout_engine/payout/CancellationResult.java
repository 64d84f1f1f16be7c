package com.flagship.payout_engine.payout;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.TransactionState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CancellationResult {

    public enum ErrorCode {
        NOT_FOUND,
        NOT_CANCELLABLE,
        PROCESSOR_REFUSED,
        PROCESSOR_UNAVAILABLE,
        CONFLICT
    }

    boolean success;
    String transactionId;
    TransactionState state;
    String error;
    ErrorCode errorCode;

    static CancellationResult cancelled(PayoutTransaction tx) {
        return CancellationResult.builder()
                .success(true)
                .transactionId(tx.getTransactionId())
                .state(tx.getState())
                .build();
    }

    static CancellationResult refused(String transactionId, TransactionState state, ErrorCode code, String error) {
        return CancellationResult.builder()
                .success(false)
                .transactionId(transactionId)
                .state(state)
                .errorCode(code)
                .error(error)
                .build();
    }
}
